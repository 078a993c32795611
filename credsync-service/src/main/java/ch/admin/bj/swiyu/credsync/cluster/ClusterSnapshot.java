/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import java.util.List;

/**
 * Point in time view of the supervisor.
 *
 * @param readyWorkers   worker slots that reported readiness, stays at the worker count once the cluster was ready
 * @param respawns       replacements started or scheduled after unexpected exits
 * @param launchFailures workers that could not be started at all
 */
public record ClusterSnapshot(
        List<WorkerView> workers,
        int workerCount,
        int readyWorkers,
        boolean clusterReady,
        boolean shuttingDown,
        int respawns,
        int launchFailures) {

    public record WorkerView(int id, int slot, long pid, WorkerState state) {
    }
}
