/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.exception;

import lombok.Getter;

@Getter
public class CredentialAlreadyIssuedException extends RuntimeException {

    private final String credentialId;

    public CredentialAlreadyIssuedException(String credentialId) {
        super("Credential already issued");
        this.credentialId = credentialId;
    }

    public CredentialAlreadyIssuedException(String credentialId, Throwable cause) {
        super("Credential already issued", cause);
        this.credentialId = credentialId;
    }
}
