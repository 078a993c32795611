/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.persistence;

import ch.admin.bj.swiyu.credsync.common.exception.CredentialAlreadyIssuedException;
import ch.admin.bj.swiyu.credsync.common.exception.JsonException;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import ch.admin.bj.swiyu.credsync.domain.credential.CredentialRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Credential store of a single service. The issuance service only ever inserts, the verification
 * service upserts whatever it receives from the issuance service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialPersistenceService {

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final CredentialRepository credentialRepository;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public Optional<Credential> findById(String id) {
        return credentialRepository.findById(id);
    }

    /**
     * Stores a newly issued credential. An existing row with the same id is never overwritten, a
     * concurrent insert losing the race on the primary key is reported as already issued.
     */
    @Transactional
    public Credential insert(Credential credential) {
        try {
            return credentialRepository.saveAndFlush(credential);
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            log.debug("Insert of credential {} rejected by the primary key", credential.getId(), e);
            throw new CredentialAlreadyIssuedException(credential.getId(), e);
        }
    }

    @Transactional
    public Credential upsert(Credential credential) {
        credentialRepository.upsert(
                credential.getId(),
                credential.getName(),
                credential.getCredentialType(),
                toJson(credential),
                credential.getIssuedBy(),
                credential.getIssuedAt(),
                credential.getHash());
        return credential;
    }

    /**
     * Upserts all credentials in one transaction, either every record is stored or none.
     */
    @Transactional
    public int upsertMany(List<Credential> credentials) {
        credentials.forEach(this::upsert);
        return credentials.size();
    }

    @Transactional(readOnly = true)
    public Optional<Instant> latestIssuedAt() {
        return credentialRepository.findLatestIssuedAt();
    }

    /**
     * @param since exclusive lower bound, null lists everything
     * @return credentials ordered by issuance instant, oldest first
     */
    @Transactional(readOnly = true)
    public List<Credential> listIssuedAfter(@Nullable Instant since) {
        if (since == null) {
            return credentialRepository.findAllByOrderByIssuedAtAscIdAsc();
        }
        return credentialRepository.findByIssuedAtAfterOrderByIssuedAtAscIdAsc(since);
    }

    private static boolean isUniqueViolation(DataIntegrityViolationException e) {
        return e.getMostSpecificCause() instanceof SQLException sqlException
                && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState());
    }

    private String toJson(Credential credential) {
        try {
            return objectMapper.writeValueAsString(credential.getDetails());
        } catch (JsonProcessingException e) {
            throw new JsonException("Details of credential %s cannot be serialized".formatted(credential.getId()), e);
        }
    }
}
