/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.exception;

public class SyncDeliveryException extends RuntimeException {
    public SyncDeliveryException(String message) {
        super(message);
    }

    public SyncDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
