/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.credential;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.api.credential.IssueCredentialRequestDto;
import ch.admin.bj.swiyu.credsync.api.credential.IssueCredentialResponseDto;
import ch.admin.bj.swiyu.credsync.common.config.ApplicationProperties;
import ch.admin.bj.swiyu.credsync.common.exception.CredentialAlreadyIssuedException;
import ch.admin.bj.swiyu.credsync.domain.credential.Credential;
import ch.admin.bj.swiyu.credsync.service.persistence.CredentialPersistenceService;
import ch.admin.bj.swiyu.credsync.service.sync.CredentialSyncEventProducer;
import jakarta.annotation.Nullable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

import static ch.admin.bj.swiyu.credsync.service.credential.CredentialMapper.toCredentialDto;
import static ch.admin.bj.swiyu.credsync.service.credential.CredentialMapper.toCredentialDtos;

@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialIssuanceService {

    private final CredentialPersistenceService persistenceService;
    private final CredentialSyncEventProducer syncEventProducer;
    private final ApplicationProperties applicationProperties;
    private final Clock clock;

    /**
     * Issues a credential for the given content. The content determines the credential id, issuing
     * identical content a second time is rejected.
     * <p>
     * The credential is pushed to the verification service once the transaction committed, the
     * outcome of that push has no influence on the response.
     */
    @Transactional
    public IssueCredentialResponseDto issueCredential(IssueCredentialRequestDto request) {
        var name = request.getName().trim();
        var credentialType = request.getCredentialType().trim();
        var details = new LinkedHashMap<>(request.getDetails());

        var id = Credential.deriveId(name, credentialType, details);
        if (persistenceService.findById(id).isPresent()) {
            log.info("Credential {} was already issued", id);
            throw new CredentialAlreadyIssuedException(id);
        }

        var workerLabel = applicationProperties.getWorkerLabel();
        var credential = persistenceService.insert(
                Credential.issue(name, credentialType, details, workerLabel, Instant.now(clock)));
        var credentialDto = toCredentialDto(credential);

        syncEventProducer.produceCredentialIssuedEvent(credentialDto);
        log.info("Credential {} of type {} issued by {}", credential.getId(), credentialType, workerLabel);

        return new IssueCredentialResponseDto(true, "credential issued by %s".formatted(workerLabel), credentialDto);
    }

    /**
     * Listing served to the verification service for its catch-up.
     */
    @Transactional(readOnly = true)
    public List<CredentialDto> getCredentialsIssuedAfter(@Nullable Instant since) {
        return toCredentialDtos(persistenceService.listIssuedAfter(since));
    }
}
