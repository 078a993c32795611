/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.api.credential;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(name = "VerifyCredentialResponse")
public record VerifyCredentialResponseDto(
        boolean valid,
        String message,
        @Schema(description = "Worker that issued the stored credential, absent when not found")
        String issuedBy,
        String issuedAt,
        @Schema(description = "Worker that performed the verification", example = "worker-2")
        String verifiedBy) {
}
