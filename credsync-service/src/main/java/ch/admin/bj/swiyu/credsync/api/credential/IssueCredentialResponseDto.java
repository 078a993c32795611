/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.api.credential;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "IssueCredentialResponse")
public record IssueCredentialResponseDto(
        boolean success,
        @Schema(example = "credential issued by worker-1")
        String message,
        CredentialDto credential) {
}
