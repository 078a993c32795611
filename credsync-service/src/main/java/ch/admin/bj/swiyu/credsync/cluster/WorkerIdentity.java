/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import java.util.Map;
import java.util.Optional;

/**
 * Identity of a worker process, handed down by the primary through the environment.
 */
public record WorkerIdentity(int workerId) {

    public static final String WORKER_ID_ENV = "CREDSYNC_WORKER_ID";

    public static Optional<WorkerIdentity> fromEnvironment() {
        return from(System.getenv());
    }

    static Optional<WorkerIdentity> from(Map<String, String> environment) {
        var value = environment.get(WORKER_ID_ENV);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new WorkerIdentity(Integer.parseInt(value.trim())));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("%s must be numeric but was '%s'".formatted(WORKER_ID_ENV, value), e);
        }
    }

    public String label() {
        return "worker-" + workerId;
    }
}
