/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.web.issuance;

import ch.admin.bj.swiyu.credsync.api.credential.IssueCredentialRequestDto;
import ch.admin.bj.swiyu.credsync.api.credential.IssueCredentialResponseDto;
import ch.admin.bj.swiyu.credsync.api.exception.ApiErrorDto;
import ch.admin.bj.swiyu.credsync.service.credential.CredentialIssuanceService;
import io.micrometer.core.annotation.Timed;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = {"/api"})
@AllArgsConstructor
@Tag(name = "Issuance API", description = "Issues tamper-evident credentials")
public class IssuanceController {

    private final CredentialIssuanceService credentialIssuanceService;

    @Timed
    @PostMapping("/issue")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
            summary = "Issue a credential with the given content",
            description = """
                    The credential id is derived from name, type and details, issuing the same content twice is rejected.
                    The issued credential is forwarded to the verification service in the background.
                    """,
            responses = {
                    @ApiResponse(
                            responseCode = "201",
                            description = "Credential issued",
                            content = @Content(schema = @Schema(implementation = IssueCredentialResponseDto.class))
                    ),
                    @ApiResponse(
                            responseCode = "409",
                            description = "A credential with the same content was already issued",
                            content = @Content(schema = @Schema(implementation = ApiErrorDto.class))
                    ),
                    @ApiResponse(
                            responseCode = "422",
                            description = "Invalid request content",
                            content = @Content(schema = @Schema(implementation = ApiErrorDto.class))
                    )
            }
    )
    public IssueCredentialResponseDto issueCredential(@Valid @RequestBody IssueCredentialRequestDto request) {
        return this.credentialIssuanceService.issueCredential(request);
    }
}
