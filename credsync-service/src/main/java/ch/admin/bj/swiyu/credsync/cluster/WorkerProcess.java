/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

/**
 * Handle of a running worker as seen by the primary.
 */
public interface WorkerProcess {

    long pid();

    /**
     * Asks the worker to drain and exit on its own.
     */
    void requestStop();

    /**
     * Kills the worker and everything it spawned.
     */
    void forceKill();
}
