/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.exception;

public class SyncUnauthorizedException extends RuntimeException {
    public SyncUnauthorizedException(String message) {
        super(message);
    }
}
