/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.exception;

public class WorkerLaunchException extends Exception {
    public WorkerLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
