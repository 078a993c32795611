/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.api.credential;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "CredentialListResponse", description = "Credentials issued after the requested cursor, oldest first")
public record CredentialListResponseDto(
        boolean success,
        int count,
        List<CredentialDto> data) {

    public static CredentialListResponseDto of(List<CredentialDto> credentials) {
        return new CredentialListResponseDto(true, credentials.size(), credentials);
    }
}
