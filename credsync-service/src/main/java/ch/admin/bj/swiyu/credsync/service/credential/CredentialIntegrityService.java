/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.credential;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.common.exception.CredentialIntegrityException;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Verifies records received from the issuance service before they are trusted.
 */
@Slf4j
@Service
public class CredentialIntegrityService {

    /**
     * @return the received record as domain object, its hash recomputed and confirmed
     * @throws CredentialIntegrityException if the carried hash does not match the content
     */
    public Credential requireAuthentic(CredentialDto received) {
        var credential = CredentialMapper.toCredential(received);
        if (!credential.hasValidHash()) {
            log.warn("Rejecting credential {} issued by {}: hash does not match its content",
                    credential.getId(), credential.getIssuedBy());
            throw new CredentialIntegrityException(credential.getId());
        }
        return credential;
    }
}
