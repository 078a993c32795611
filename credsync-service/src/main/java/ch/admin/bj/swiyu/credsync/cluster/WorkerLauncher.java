/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import ch.admin.bj.swiyu.credsync.common.exception.WorkerLaunchException;

public interface WorkerLauncher {

    /**
     * Starts a worker. Readiness and exit of the worker are reported to the listener.
     */
    WorkerProcess launch(int workerId, WorkerEventListener listener) throws WorkerLaunchException;
}
