/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.exception;

import lombok.Getter;

/**
 * The hash carried by a credential record does not match the hash recomputed from its content.
 */
@Getter
public class CredentialIntegrityException extends RuntimeException {

    private final String credentialId;

    public CredentialIntegrityException(String credentialId) {
        super("Hash mismatch for credential %s".formatted(credentialId));
        this.credentialId = credentialId;
    }
}
