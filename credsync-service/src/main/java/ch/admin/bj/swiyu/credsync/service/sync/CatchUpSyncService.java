/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.common.exception.CredentialIntegrityException;
import ch.admin.bj.swiyu.credsync.common.exception.SyncProtocolException;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import ch.admin.bj.swiyu.credsync.service.credential.CredentialIntegrityService;
import ch.admin.bj.swiyu.credsync.service.persistence.CredentialPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Brings the verification store up to date with the issuance service.
 * <p>
 * The latest stored issuance instant is the cursor. Every fetched record is verified before
 * anything is stored: a single hash mismatch discards the whole batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatchUpSyncService {

    private final IssuanceCatchUpClient catchUpClient;
    private final CredentialPersistenceService persistenceService;
    private final CredentialIntegrityService integrityService;

    /**
     * @return number of credentials stored
     * @throws SyncProtocolException        if the issuance service misbehaves
     * @throws CredentialIntegrityException if any fetched record fails the hash check, nothing is stored then
     */
    public int performCatchUpSync() {
        Optional<Instant> cursor = persistenceService.latestIssuedAt();
        log.debug("Starting catch-up sync from cursor {}", cursor.orElse(null));

        var fetched = catchUpClient.fetchIssuedAfter(cursor.orElse(null));
        List<Credential> verified = fetched.stream()
                .map(integrityService::requireAuthentic)
                .toList();

        var newer = verified.stream()
                .filter(credential -> cursor.map(credential.getIssuedAt()::isAfter).orElse(true))
                .toList();
        if (newer.size() < verified.size()) {
            log.warn("Issuance service returned {} credential(s) not newer than cursor {}, ignoring them",
                    verified.size() - newer.size(), cursor.orElse(null));
        }
        if (newer.isEmpty()) {
            log.info("Catch-up sync found no missing credentials");
            return 0;
        }

        var stored = persistenceService.upsertMany(newer);
        log.info("Catch-up sync stored {} credential(s)", stored);
        return stored;
    }
}
