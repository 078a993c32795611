/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.web.verification;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.api.credential.VerifyCredentialResponseDto;
import ch.admin.bj.swiyu.credsync.service.credential.CredentialVerificationService;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = {"/api"})
@AllArgsConstructor
@Tag(name = "Verification API", description = "Checks presented credentials against the synchronized store")
public class VerificationController {

    private final CredentialVerificationService credentialVerificationService;

    @Timed
    @PostMapping("/verify")
    @Operation(summary = "Verify a presented credential",
            description = "The outcome is reported in the body, an unknown or altered credential is not an error.")
    public VerifyCredentialResponseDto verifyCredential(@Valid @RequestBody CredentialDto credential) {
        return this.credentialVerificationService.verifyCredential(credential);
    }
}
