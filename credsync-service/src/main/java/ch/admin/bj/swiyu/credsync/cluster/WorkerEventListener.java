/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

/**
 * Receives what workers report. Called from launcher threads, implementations must hand over to their own thread.
 */
public interface WorkerEventListener {

    void onReady(int workerId);

    void onExit(int workerId, int exitCode);
}
