/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.scheduler;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outcome of the most recent catch-up run of this worker.
 */
@Component
public class CatchUpSyncStatus {

    public record Outcome(boolean succeeded, Instant finishedAt, int storedCredentials, String error) {
    }

    private final AtomicReference<Outcome> lastOutcome = new AtomicReference<>();

    void recordSuccess(Instant finishedAt, int storedCredentials) {
        lastOutcome.set(new Outcome(true, finishedAt, storedCredentials, null));
    }

    void recordFailure(Instant finishedAt, Exception error) {
        lastOutcome.set(new Outcome(false, finishedAt, 0, Objects.toString(error.getMessage(), error.getClass().getSimpleName())));
    }

    public Optional<Outcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }
}
