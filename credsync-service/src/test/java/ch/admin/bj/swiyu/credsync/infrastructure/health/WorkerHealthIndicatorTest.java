package ch.admin.bj.swiyu.credsync.infrastructure.health;

import ch.admin.bj.swiyu.credsync.common.config.ApplicationProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerHealthIndicatorTest {

    @Test
    void health_namesAnsweringWorker() {
        var applicationProperties = new ApplicationProperties();
        applicationProperties.setWorkerId("host-a");

        var health = new WorkerHealthIndicator(applicationProperties).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("worker", "worker-host-a")
                .containsEntry("pid", ProcessHandle.current().pid());
    }
}
