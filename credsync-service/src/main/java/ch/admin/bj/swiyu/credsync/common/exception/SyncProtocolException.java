/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.exception;

/**
 * The peer service answered in a way that violates the synchronization contract
 * (unexpected status, unreadable body, missing records) or could not be reached at all.
 */
public class SyncProtocolException extends RuntimeException {
    public SyncProtocolException(String message) {
        super(message);
    }

    public SyncProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
