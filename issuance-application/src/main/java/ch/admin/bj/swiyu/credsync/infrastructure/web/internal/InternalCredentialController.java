/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.web.internal;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialListResponseDto;
import ch.admin.bj.swiyu.credsync.common.date.TimeUtils;
import ch.admin.bj.swiyu.credsync.common.exception.BadRequestException;
import ch.admin.bj.swiyu.credsync.service.credential.CredentialIssuanceService;
import ch.admin.bj.swiyu.credsync.service.sync.SyncSecretVerifier;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping(value = {"/internal"})
@AllArgsConstructor
@Tag(name = "Internal Sync API", description = "Used by the verification service to catch up on missed credentials")
@SecurityRequirement(name = "internal-sync-key")
public class InternalCredentialController {

    private final CredentialIssuanceService credentialIssuanceService;
    private final SyncSecretVerifier syncSecretVerifier;

    @Timed
    @GetMapping("/credentials")
    @Operation(summary = "List credentials issued after the given instant, oldest first")
    public CredentialListResponseDto getCredentials(
            @RequestHeader HttpHeaders headers,
            @Parameter(description = "Exclusive ISO-8601 cursor, everything is listed when absent", example = "2025-03-01T10:15:30.123Z")
            @RequestParam(name = "since", required = false) String since) {
        syncSecretVerifier.verify(headers, "Unauthorized access");

        Instant cursor = null;
        if (since != null) {
            cursor = TimeUtils.parseIso8601(since)
                    .orElseThrow(() -> new BadRequestException("Invalid since parameter. Expect ISO-8601 string."));
        }
        return CredentialListResponseDto.of(credentialIssuanceService.getCredentialsIssuedAfter(cursor));
    }
}
