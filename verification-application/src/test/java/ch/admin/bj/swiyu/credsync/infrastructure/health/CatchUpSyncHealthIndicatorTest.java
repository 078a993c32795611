package ch.admin.bj.swiyu.credsync.infrastructure.health;

import ch.admin.bj.swiyu.credsync.infrastructure.scheduler.CatchUpSyncStatus;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatchUpSyncHealthIndicatorTest {

    private final CatchUpSyncStatus catchUpSyncStatus = mock(CatchUpSyncStatus.class);
    private final CatchUpSyncHealthIndicator healthIndicator = new CatchUpSyncHealthIndicator(catchUpSyncStatus);

    @Test
    void health_beforeFirstRun_isUnknown() {
        when(catchUpSyncStatus.getLastOutcome()).thenReturn(Optional.empty());

        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }

    @Test
    void health_afterSuccessfulRun_reportsStoredCredentials() {
        when(catchUpSyncStatus.getLastOutcome()).thenReturn(Optional.of(
                new CatchUpSyncStatus.Outcome(true, Instant.parse("2025-03-01T10:15:30Z"), 3, null)));

        var health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("lastRunSucceeded", true)
                .containsEntry("finishedAt", "2025-03-01T10:15:30Z")
                .containsEntry("storedCredentials", 3)
                .doesNotContainKey("error");
    }

    @Test
    void health_afterFailedRun_staysUpWithError() {
        when(catchUpSyncStatus.getLastOutcome()).thenReturn(Optional.of(
                new CatchUpSyncStatus.Outcome(false, Instant.parse("2025-03-01T10:15:30Z"), 0, "Issuance service not reachable")));

        var health = healthIndicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("lastRunSucceeded", false)
                .containsEntry("error", "Issuance service not reachable");
    }
}
