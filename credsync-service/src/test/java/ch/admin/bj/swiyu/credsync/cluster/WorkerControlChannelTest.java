package ch.admin.bj.swiyu.credsync.cluster;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerControlChannelTest {

    @Test
    void sendReady_writesMarkerOnce() {
        var output = new ByteArrayOutputStream();
        var channel = new WorkerControlChannel(input(""), new PrintStream(output, true, StandardCharsets.UTF_8));

        channel.sendReady();
        channel.sendReady();

        assertThat(output.toString(StandardCharsets.UTF_8).lines()).containsExactly(WorkerMessage.READY.encode());
    }

    @Test
    void listenForStop_runsCallbackOnStopRequest() throws Exception {
        var channel = new WorkerControlChannel(
                input("some noise\n" + WorkerMessage.STOP.encode() + "\nignored\n"), System.out);
        var stops = new AtomicInteger();
        var stopped = new CountDownLatch(1);

        var listener = channel.listenForStop(() -> {
            stops.incrementAndGet();
            stopped.countDown();
        });

        assertThat(stopped.await(5, TimeUnit.SECONDS)).isTrue();
        listener.join(5000);
        assertThat(stops).hasValue(1);
    }

    @Test
    void listenForStop_runsCallbackWhenPrimaryGoesAway() throws Exception {
        var channel = new WorkerControlChannel(input("unrelated\n"), System.out);
        var stopped = new CountDownLatch(1);

        channel.listenForStop(stopped::countDown);

        assertThat(stopped.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void listenForStop_onlyOnce() {
        var channel = new WorkerControlChannel(input(""), System.out);
        channel.listenForStop(() -> {
        });

        assertThatThrownBy(() -> channel.listenForStop(() -> {
        })).isInstanceOf(IllegalStateException.class);
    }

    private static ByteArrayInputStream input(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
