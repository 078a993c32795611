package ch.admin.bj.swiyu.credsync.cluster;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.boot.web.server.WebServer;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WorkerReadinessNotifierTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private WorkerControlChannel controlChannel;

    @BeforeEach
    void setUp() {
        controlChannel = new WorkerControlChannel(new ByteArrayInputStream(new byte[0]),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    @Test
    void worker_reportsReadinessOnceServerIsBound() {
        var notifier = new WorkerReadinessNotifier(Optional.of(new WorkerIdentity(2)), controlChannel);

        notifier.onApplicationEvent(event(null));

        assertThat(output.toString(StandardCharsets.UTF_8)).contains(WorkerMessage.READY.encode());
    }

    @Test
    void managementServer_isNotReported() {
        var notifier = new WorkerReadinessNotifier(Optional.of(new WorkerIdentity(2)), controlChannel);

        notifier.onApplicationEvent(event("management"));

        assertThat(output.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void standaloneProcess_isNotReported() {
        var notifier = new WorkerReadinessNotifier(Optional.empty(), controlChannel);

        notifier.onApplicationEvent(event(null));

        assertThat(output.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    private static WebServerInitializedEvent event(String serverNamespace) {
        var context = mock(WebServerApplicationContext.class);
        when(context.getServerNamespace()).thenReturn(serverNamespace);
        var webServer = mock(WebServer.class);
        when(webServer.getPort()).thenReturn(3001);
        var event = mock(WebServerInitializedEvent.class);
        when(event.getApplicationContext()).thenReturn(context);
        when(event.getWebServer()).thenReturn(webServer);
        return event;
    }
}
