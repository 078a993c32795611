/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import java.util.Optional;

/**
 * Control messages exchanged between primary and workers, one per line.
 * Workers write {@link #READY} to stdout, the primary writes {@link #STOP} to the worker's stdin.
 * The marker prefix keeps them apart from regular log output on the same stream.
 */
public enum WorkerMessage {
    READY,
    STOP;

    private static final String MARKER = "@@credsync-cluster:";

    public String encode() {
        return MARKER + name();
    }

    public static Optional<WorkerMessage> decode(String line) {
        if (line == null || !line.startsWith(MARKER)) {
            return Optional.empty();
        }
        var name = line.substring(MARKER.length()).trim();
        for (var message : values()) {
            if (message.name().equals(name)) {
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }
}
