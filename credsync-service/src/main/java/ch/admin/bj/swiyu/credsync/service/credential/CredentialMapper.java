/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.credential;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.common.date.TimeUtils;
import ch.admin.bj.swiyu.credsync.common.exception.BadRequestException;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import lombok.experimental.UtilityClass;

import java.util.List;

@UtilityClass
public class CredentialMapper {

    public static CredentialDto toCredentialDto(Credential credential) {
        return CredentialDto.builder()
                .id(credential.getId())
                .name(credential.getName())
                .credentialType(credential.getCredentialType())
                .details(credential.getDetails())
                .issuedBy(credential.getIssuedBy())
                .issuedAt(credential.getIssuedAtIso())
                .hash(credential.getHash())
                .build();
    }

    public static List<CredentialDto> toCredentialDtos(List<Credential> credentials) {
        return credentials.stream().map(CredentialMapper::toCredentialDto).toList();
    }

    /**
     * Maps a received record as is, the hash is taken over and not recomputed.
     *
     * @throws BadRequestException if issuedAt is not rendered with millisecond precision in UTC
     */
    public static Credential toCredential(CredentialDto dto) {
        var issuedAt = TimeUtils.parseIsoMillis(dto.getIssuedAt())
                .orElseThrow(() -> new BadRequestException(
                        "issuedAt of credential %s must be an ISO-8601 UTC instant with millisecond precision".formatted(dto.getId())));
        return Credential.builder()
                .id(dto.getId())
                .name(dto.getName())
                .credentialType(dto.getCredentialType())
                .details(dto.getDetails())
                .issuedBy(dto.getIssuedBy())
                .issuedAt(issuedAt)
                .hash(dto.getHash())
                .build();
    }
}
