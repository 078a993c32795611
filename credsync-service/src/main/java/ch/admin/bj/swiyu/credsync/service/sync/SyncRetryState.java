/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import java.time.Duration;

/**
 * State of a bounded push with linear backoff.
 * <pre>
 * ATTEMPTING(1) -success-> SUCCEEDED
 * ATTEMPTING(n) -failure-> ATTEMPTING(n+1)  while n &lt; maxAttempts
 * ATTEMPTING(n) -failure-> EXHAUSTED        when n == maxAttempts
 * </pre>
 *
 * @param attempt number of the current attempt, or of the last one once the state is terminal
 */
public record SyncRetryState(Phase phase, int attempt, int maxAttempts) {

    public enum Phase {
        ATTEMPTING,
        SUCCEEDED,
        EXHAUSTED
    }

    public SyncRetryState {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was %s".formatted(maxAttempts));
        }
        if (attempt < 1 || attempt > maxAttempts) {
            throw new IllegalArgumentException("attempt %s out of range 1..%s".formatted(attempt, maxAttempts));
        }
    }

    public static SyncRetryState initial(int maxAttempts) {
        return new SyncRetryState(Phase.ATTEMPTING, 1, maxAttempts);
    }

    public SyncRetryState onSuccess() {
        requireAttempting();
        return new SyncRetryState(Phase.SUCCEEDED, attempt, maxAttempts);
    }

    public SyncRetryState onFailure() {
        requireAttempting();
        if (attempt >= maxAttempts) {
            return new SyncRetryState(Phase.EXHAUSTED, attempt, maxAttempts);
        }
        return new SyncRetryState(Phase.ATTEMPTING, attempt + 1, maxAttempts);
    }

    /**
     * Wait before the current attempt: none before the first, {@code baseDelay * (attempt - 1)} before later ones.
     */
    public Duration delayBeforeAttempt(Duration baseDelay) {
        requireAttempting();
        return baseDelay.multipliedBy(attempt - 1L);
    }

    public boolean isTerminal() {
        return phase != Phase.ATTEMPTING;
    }

    private void requireAttempting() {
        if (isTerminal()) {
            throw new IllegalStateException("Push already finished with %s after %s attempt(s)".formatted(phase, attempt));
        }
    }
}
