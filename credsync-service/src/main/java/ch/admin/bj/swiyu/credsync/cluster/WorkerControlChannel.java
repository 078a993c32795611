/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker end of the control channel to the primary: readiness goes out on stdout, stop requests come in on stdin.
 */
@Slf4j
public class WorkerControlChannel {

    private static final WorkerControlChannel CURRENT_PROCESS = new WorkerControlChannel(System.in, System.out);

    private final InputStream input;
    private final PrintStream output;
    private final AtomicBoolean readySent = new AtomicBoolean();
    private final AtomicBoolean listening = new AtomicBoolean();

    WorkerControlChannel(InputStream input, PrintStream output) {
        this.input = input;
        this.output = output;
    }

    public static WorkerControlChannel forCurrentProcess() {
        return CURRENT_PROCESS;
    }

    /**
     * Reports readiness once, later calls are ignored.
     */
    public void sendReady() {
        if (readySent.compareAndSet(false, true)) {
            output.println(WorkerMessage.READY.encode());
            output.flush();
        }
    }

    /**
     * Runs {@code onStop} on a background thread as soon as the primary requests a stop or goes away (stdin closed).
     */
    public Thread listenForStop(Runnable onStop) {
        if (!listening.compareAndSet(false, true)) {
            throw new IllegalStateException("Already listening for stop requests");
        }
        var listener = new Thread(() -> awaitStop(onStop), "worker-control-channel");
        listener.setDaemon(true);
        listener.start();
        return listener;
    }

    private void awaitStop(Runnable onStop) {
        try (var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (WorkerMessage.decode(line).filter(WorkerMessage.STOP::equals).isPresent()) {
                    log.info("Stop requested by primary");
                    onStop.run();
                    return;
                }
            }
            log.warn("Control channel to primary closed, stopping");
        } catch (IOException e) {
            log.warn("Control channel to primary broken, stopping", e);
        }
        onStop.run();
    }
}
