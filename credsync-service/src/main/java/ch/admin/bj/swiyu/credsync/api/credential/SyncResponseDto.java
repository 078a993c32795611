/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.api.credential;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SyncResponse")
public record SyncResponseDto(boolean success, String message) {
}
