/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * A worker registered with the supervisor. Only ever touched by the supervisor thread.
 */
@Getter
class Worker {

    private final int id;
    /**
     * Position among the configured workers, a replacement takes over the slot of the worker it replaces
     */
    private final int slot;
    private final WorkerProcess process;
    private final Instant spawnedAt;
    private WorkerState state = WorkerState.STARTING;

    Worker(int id, int slot, WorkerProcess process, Instant spawnedAt) {
        this.id = id;
        this.slot = slot;
        this.process = process;
        this.spawnedAt = spawnedAt;
    }

    void transitionTo(WorkerState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Worker %s cannot move from %s to %s".formatted(id, state, next));
        }
        state = next;
    }

    Duration uptime(Instant now) {
        return Duration.between(spawnedAt, now);
    }
}
