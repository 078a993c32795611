/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import java.util.Set;

public enum WorkerState {
    STARTING,
    READY,
    DRAINING,
    EXITED;

    public boolean canTransitionTo(WorkerState next) {
        return switch (this) {
            case STARTING -> Set.of(READY, DRAINING, EXITED).contains(next);
            case READY -> Set.of(DRAINING, EXITED).contains(next);
            case DRAINING -> next == EXITED;
            case EXITED -> false;
        };
    }
}
