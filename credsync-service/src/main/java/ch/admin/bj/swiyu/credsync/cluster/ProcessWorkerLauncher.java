/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import ch.admin.bj.swiyu.credsync.common.exception.WorkerLaunchException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Starts workers as child JVMs. The worker's stdout is scanned for control messages, everything else
 * is forwarded to the primary's stdout. Stderr is inherited.
 */
@Slf4j
public class ProcessWorkerLauncher implements WorkerLauncher {

    private static final long OUTPUT_DRAIN_TIMEOUT_MILLIS = 1000;

    private final WorkerCommand command;
    private final PrintStream forwardTo;

    public ProcessWorkerLauncher(WorkerCommand command) {
        this(command, System.out);
    }

    ProcessWorkerLauncher(WorkerCommand command, PrintStream forwardTo) {
        this.command = command;
        this.forwardTo = forwardTo;
    }

    @Override
    public WorkerProcess launch(int workerId, WorkerEventListener listener) throws WorkerLaunchException {
        var builder = new ProcessBuilder(command.arguments())
                .redirectError(ProcessBuilder.Redirect.INHERIT);
        builder.environment().put(WorkerIdentity.WORKER_ID_ENV, String.valueOf(workerId));

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new WorkerLaunchException("Could not start worker %s".formatted(workerId), e);
        }

        var outputReader = new Thread(() -> readOutput(workerId, process, listener), "worker-%s-output".formatted(workerId));
        outputReader.setDaemon(true);
        outputReader.start();

        process.onExit().thenAccept(exited -> {
            // deliver a READY printed right before exiting ahead of the exit itself
            try {
                outputReader.join(OUTPUT_DRAIN_TIMEOUT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            listener.onExit(workerId, exited.exitValue());
        });
        return new ChildWorkerProcess(process);
    }

    private void readOutput(int workerId, Process process, WorkerEventListener listener) {
        try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                var message = WorkerMessage.decode(line);
                if (message.filter(WorkerMessage.READY::equals).isPresent()) {
                    listener.onReady(workerId);
                } else {
                    forwardTo.println(line);
                }
            }
        } catch (IOException e) {
            log.debug("Output of worker {} closed", workerId, e);
        }
    }

    static class ChildWorkerProcess implements WorkerProcess {

        private final Process process;

        ChildWorkerProcess(Process process) {
            this.process = process;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public void requestStop() {
            try {
                var stdin = process.getOutputStream();
                stdin.write((WorkerMessage.STOP.encode() + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            } catch (IOException e) {
                log.warn("Could not send stop request to worker pid {}, terminating it", process.pid(), e);
                process.destroy();
            }
        }

        @Override
        public void forceKill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
