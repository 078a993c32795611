/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.web.internal;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.api.credential.SyncResponseDto;
import ch.admin.bj.swiyu.credsync.service.credential.CredentialVerificationService;
import ch.admin.bj.swiyu.credsync.service.sync.SyncSecretVerifier;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = {"/internal"})
@AllArgsConstructor
@Tag(name = "Internal Sync API", description = "Receives credentials pushed by the issuance service")
@SecurityRequirement(name = "internal-sync-key")
public class InternalSyncController {

    private final CredentialVerificationService credentialVerificationService;
    private final SyncSecretVerifier syncSecretVerifier;
    private final Validator validator;

    @Timed
    @PostMapping("/sync")
    @Operation(summary = "Store a credential issued by the issuance service after checking its hash")
    public SyncResponseDto syncCredential(@RequestHeader HttpHeaders headers, @RequestBody CredentialDto credential) {
        // the secret is checked before the payload is even looked at
        syncSecretVerifier.verify(headers, "Unauthorized sync request");

        var violations = validator.validate(credential);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return credentialVerificationService.receiveSyncedCredential(credential);
    }
}
