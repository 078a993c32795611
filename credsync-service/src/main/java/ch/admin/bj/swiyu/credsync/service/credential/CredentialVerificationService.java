/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.credential;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.api.credential.SyncResponseDto;
import ch.admin.bj.swiyu.credsync.api.credential.VerifyCredentialResponseDto;
import ch.admin.bj.swiyu.credsync.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.credsync.common.exception.BadRequestException;
import ch.admin.bj.swiyu.credsync.common.exception.CredentialIntegrityException;
import ch.admin.bj.swiyu.credsync.common.hash.CanonicalHasher;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import ch.admin.bj.swiyu.credsync.service.persistence.CredentialPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialVerificationService {

    static final String NOT_FOUND_MESSAGE = "Credential not found";
    static final String MISMATCH_MESSAGE = "Credential data mismatch";
    static final String VERIFIED_MESSAGE = "Credential verified successfully";

    private final CredentialPersistenceService persistenceService;
    private final CredentialIntegrityService integrityService;
    private final ApplicationProperties applicationProperties;

    /**
     * A presented credential is valid when a record with the same id is stored, every field of
     * the presentation equals the stored one, and both the stored and the presented hash match
     * their content.
     */
    @Transactional(readOnly = true)
    public VerifyCredentialResponseDto verifyCredential(CredentialDto presented) {
        var verifiedBy = applicationProperties.getWorkerLabel();
        var stored = persistenceService.findById(presented.getId());
        if (stored.isEmpty()) {
            log.debug("Credential {} presented to {} is unknown", presented.getId(), verifiedBy);
            return VerifyCredentialResponseDto.builder()
                    .valid(false)
                    .message(NOT_FOUND_MESSAGE)
                    .verifiedBy(verifiedBy)
                    .build();
        }

        var credential = stored.get();
        var valid = matchesStoredRecord(credential, presented)
                && credential.hasValidHash()
                && CanonicalHasher.digestsEqual(presented.getHash(), credential.computeHash());
        if (!valid) {
            log.info("Credential {} presented to {} does not match the stored record", credential.getId(), verifiedBy);
        }

        return VerifyCredentialResponseDto.builder()
                .valid(valid)
                .message(valid ? VERIFIED_MESSAGE : MISMATCH_MESSAGE)
                .issuedBy(credential.getIssuedBy())
                .issuedAt(credential.getIssuedAtIso())
                .verifiedBy(verifiedBy)
                .build();
    }

    /**
     * Stores a credential pushed by the issuance service after checking its hash. Receiving the
     * same credential again replaces the stored record with identical content.
     */
    @Transactional
    public SyncResponseDto receiveSyncedCredential(CredentialDto pushed) {
        Credential credential;
        try {
            credential = integrityService.requireAuthentic(pushed);
        } catch (CredentialIntegrityException e) {
            throw new BadRequestException("Invalid credential hash", e);
        }
        persistenceService.upsert(credential);
        log.info("Credential {} issued by {} synchronized", credential.getId(), credential.getIssuedBy());
        return new SyncResponseDto(true, "Credential synchronized successfully");
    }

    private static boolean matchesStoredRecord(Credential stored, CredentialDto presented) {
        return Objects.equals(stored.getName(), presented.getName())
                && Objects.equals(stored.getCredentialType(), presented.getCredentialType())
                && Objects.equals(stored.getIssuedBy(), presented.getIssuedBy())
                && Objects.equals(stored.getIssuedAtIso(), presented.getIssuedAt())
                && Objects.equals(stored.getHash(), presented.getHash())
                && CanonicalHasher.canonicalize(stored.getDetails()).equals(CanonicalHasher.canonicalize(presented.getDetails()));
    }
}
