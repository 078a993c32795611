/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.api.credential;

import ch.admin.bj.swiyu.credsync.common.validation.ValidCredentialDetails;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Full credential record as exchanged between the services and presented for verification.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Credential")
public class CredentialDto {

    @NotBlank
    @Schema(description = "Content derived identifier, SHA-256 hex", example = "3f9a0c...")
    private String id;

    @NotBlank
    @Size(max = 255)
    private String name;

    @NotBlank
    @Size(max = 255)
    private String credentialType;

    @NotNull
    @ValidCredentialDetails
    @Schema(description = "Arbitrary claims of the credential", example = "{\"degree\":\"MSc\"}")
    private Map<String, Object> details;

    @NotBlank
    @Schema(description = "Label of the worker process that issued the credential", example = "worker-1")
    private String issuedBy;

    @NotBlank
    @Schema(description = "Issuance instant, ISO-8601 UTC with millisecond precision", example = "2025-03-01T10:15:30.123Z")
    private String issuedAt;

    @NotBlank
    @Size(min = 64, max = 64, message = "Hash must be 64 characters long")
    @Pattern(regexp = "^[0-9a-f]*$", message = "Hash must be lowercase hex")
    private String hash;
}
