package ch.admin.bj.swiyu.credsync.cluster;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerCommandTest {

    @Test
    void forCurrentJvm_restartsSameJavaWithSameArguments() {
        var command = WorkerCommand.forCurrentJvm(StubWorkerMain.class, new String[]{"--server.port=3001"});

        assertThat(Path.of(command.arguments().get(0))).isEqualTo(Path.of(System.getProperty("java.home"), "bin", "java"));
        assertThat(command.arguments()).last().isEqualTo("--server.port=3001");
        assertThat(command.arguments()).noneMatch(argument -> argument.startsWith("-agentlib:jdwp"));
        assertThat(command.arguments()).containsAnyOf("-cp", "-jar");
    }
}
