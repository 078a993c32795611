/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import ch.admin.bj.swiyu.credsync.common.config.ClusterProperties;
import ch.admin.bj.swiyu.credsync.common.exception.WorkerLaunchException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps a fixed number of worker processes alive and stops them on shutdown.
 * <p>
 * All state lives on a single supervisor thread. Worker events arrive on launcher threads and are
 * posted to that thread, so registry, ready count and flags are never shared.
 * <ul>
 *     <li>A worker that exits while the cluster is running is replaced by exactly one new worker.</li>
 *     <li>The cluster ready callback runs once, after every configured slot reported readiness.</li>
 *     <li>Shutdown asks every worker to stop and kills the remaining ones once the grace period expired.</li>
 * </ul>
 * Running a service without any child process for a worker count of 1 is up to the caller, see
 * {@link ClusterBootstrap}.
 */
@Slf4j
public class ClusterSupervisor {

    private static final Duration SHUTDOWN_WAIT_MARGIN = Duration.ofSeconds(5);

    private final WorkerLauncher launcher;
    private final ClusterProperties properties;
    private final Runnable onClusterReady;
    private final Clock clock;
    private final int availableProcessors;
    private final CrashLoopGuard crashLoopGuard;
    private final ScheduledExecutorService mailbox;
    private final WorkerEventListener eventListener = new MailboxEventListener();
    private final AtomicBoolean started = new AtomicBoolean();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    // Owned by the mailbox thread
    private final Map<Integer, Worker> workers = new TreeMap<>();
    private final Set<Integer> readySlots = new HashSet<>();
    private int nextWorkerId = 1;
    private int workerCount;
    private boolean clusterReady;
    private boolean shuttingDown;
    private int respawns;
    private int launchFailures;
    private ScheduledFuture<?> shutdownDeadline;

    public ClusterSupervisor(WorkerLauncher launcher, ClusterProperties properties, Runnable onClusterReady) {
        this(launcher, properties, onClusterReady, Clock.systemUTC(), Runtime.getRuntime().availableProcessors());
    }

    ClusterSupervisor(WorkerLauncher launcher, ClusterProperties properties, Runnable onClusterReady,
                      Clock clock, int availableProcessors) {
        this.launcher = launcher;
        this.properties = properties;
        this.onClusterReady = onClusterReady;
        this.clock = clock;
        this.availableProcessors = availableProcessors;
        this.crashLoopGuard = new CrashLoopGuard(properties);
        this.mailbox = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cluster-supervisor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Spawns the workers and returns, workers report readiness asynchronously.
     *
     * @throws IllegalArgumentException if workerCount is below 1
     * @throws IllegalStateException    if the supervisor was already started
     */
    public void start(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1 but was %s".formatted(workerCount));
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Cluster supervisor already started");
        }
        if (workerCount > availableProcessors) {
            log.warn("{} workers requested but only {} processors available", workerCount, availableProcessors);
        }

        mailbox.execute(guarded(() -> {
            this.workerCount = workerCount;
            log.info("Primary {} is starting {} worker(s)", ProcessHandle.current().pid(), workerCount);
            for (int slot = 0; slot < workerCount; slot++) {
                spawn(slot);
            }
        }));
    }

    /**
     * Stops the workers. Calling it again returns the same future without side effects.
     *
     * @return completes once every worker exited or was killed after the grace period
     */
    public CompletableFuture<Void> shutdown() {
        try {
            mailbox.execute(guarded(this::beginShutdown));
        } catch (RejectedExecutionException e) {
            log.debug("Supervisor already closed", e);
        }
        return termination;
    }

    /**
     * Blocking variant of {@link #shutdown()} used when the primary process terminates.
     */
    public void shutdownAndAwait() {
        var maxWait = properties.shutdownGracePeriod().plus(SHUTDOWN_WAIT_MARGIN);
        try {
            shutdown().get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the workers to stop");
        } catch (ExecutionException | TimeoutException e) {
            log.error("Workers did not stop within {}", maxWait, e);
        } finally {
            mailbox.shutdownNow();
        }
    }

    public void awaitTermination() {
        termination.join();
    }

    public CompletableFuture<Void> getTermination() {
        return termination;
    }

    public ClusterSnapshot snapshot() {
        return CompletableFuture.supplyAsync(this::buildSnapshot, mailbox).join();
    }

    private void spawn(int slot) {
        if (shuttingDown) {
            log.debug("Not starting a worker for slot {}, shutdown in progress", slot);
            return;
        }
        var workerId = nextWorkerId++;
        try {
            var process = launcher.launch(workerId, eventListener);
            workers.put(workerId, new Worker(workerId, slot, process, clock.instant()));
            log.info("Worker {} started with pid {}", workerId, process.pid());
        } catch (WorkerLaunchException | RuntimeException e) {
            launchFailures++;
            var retryIn = crashLoopGuard.launchRetryDelay();
            log.error("Failed to launch worker {} for slot {}, retrying in {}", workerId, slot, retryIn, e);
            mailbox.schedule(guarded(() -> spawn(slot)), retryIn.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void handleReady(int workerId) {
        var worker = workers.get(workerId);
        if (worker == null || worker.getState() != WorkerState.STARTING) {
            log.debug("Ignoring readiness of worker {}", workerId);
            return;
        }
        worker.transitionTo(WorkerState.READY);

        if (clusterReady) {
            log.info("Replacement worker {} is ready", workerId);
            return;
        }
        readySlots.add(worker.getSlot());
        log.info("Worker {} is ready ({}/{})", workerId, readySlots.size(), workerCount);
        if (readySlots.size() == workerCount) {
            clusterReady = true;
            try {
                onClusterReady.run();
            } catch (RuntimeException e) {
                log.error("Cluster ready callback failed", e);
            }
        }
    }

    private void handleExit(int workerId, int exitCode) {
        var worker = workers.remove(workerId);
        if (worker == null) {
            log.debug("Ignoring exit of unknown worker {}", workerId);
            return;
        }
        var uptime = worker.uptime(clock.instant());
        worker.transitionTo(WorkerState.EXITED);
        if (!clusterReady) {
            readySlots.remove(worker.getSlot());
        }

        if (shuttingDown) {
            log.info("Worker {} exited with code {}", workerId, exitCode);
            if (workers.isEmpty()) {
                completeShutdown();
            }
            return;
        }

        log.error("Worker {} (pid {}) died with exit code {} after {}, restarting",
                workerId, worker.getProcess().pid(), exitCode, uptime);
        respawns++;
        var delay = crashLoopGuard.recordExit(uptime);
        if (delay.isZero()) {
            spawn(worker.getSlot());
        } else {
            mailbox.schedule(guarded(() -> spawn(worker.getSlot())), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void beginShutdown() {
        if (shuttingDown) {
            return;
        }
        shuttingDown = true;
        if (workers.isEmpty()) {
            completeShutdown();
            return;
        }

        var gracePeriod = properties.shutdownGracePeriod();
        log.info("Stopping {} worker(s), grace period {}", workers.size(), gracePeriod);
        workers.values().forEach(worker -> {
            worker.transitionTo(WorkerState.DRAINING);
            worker.getProcess().requestStop();
        });
        shutdownDeadline = mailbox.schedule(guarded(this::enforceShutdownDeadline), gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void enforceShutdownDeadline() {
        if (workers.isEmpty()) {
            return;
        }
        log.error("Shutdown grace period of {} expired with {} worker(s) still running, killing them",
                properties.shutdownGracePeriod(), workers.size());
        workers.values().forEach(worker -> worker.getProcess().forceKill());
        termination.complete(null);
    }

    private void completeShutdown() {
        if (shutdownDeadline != null) {
            shutdownDeadline.cancel(false);
        }
        log.info("All workers stopped");
        termination.complete(null);
    }

    private ClusterSnapshot buildSnapshot() {
        var views = workers.values().stream()
                .map(worker -> new ClusterSnapshot.WorkerView(worker.getId(), worker.getSlot(), worker.getProcess().pid(), worker.getState()))
                .toList();
        var readyWorkers = clusterReady ? workerCount : readySlots.size();
        return new ClusterSnapshot(views, workerCount, readyWorkers, clusterReady, shuttingDown, respawns, launchFailures);
    }

    /**
     * Tasks of a scheduled executor keep their failure in a future nobody reads, log it instead.
     */
    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Cluster supervisor task failed", e);
            }
        };
    }

    private class MailboxEventListener implements WorkerEventListener {

        @Override
        public void onReady(int workerId) {
            post(() -> handleReady(workerId));
        }

        @Override
        public void onExit(int workerId, int exitCode) {
            post(() -> handleExit(workerId, exitCode));
        }

        private void post(Runnable event) {
            try {
                mailbox.execute(guarded(event));
            } catch (RejectedExecutionException e) {
                log.debug("Dropping worker event, supervisor closed", e);
            }
        }
    }
}
