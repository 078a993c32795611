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
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "IssueCredentialRequest")
public class IssueCredentialRequestDto {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @NotBlank(message = "Credential type is required")
    @Size(max = 255, message = "Credential type must be at most 255 characters")
    private String credentialType;

    @NotNull(message = "Details are required")
    @ValidCredentialDetails
    private Map<String, Object> details;
}
