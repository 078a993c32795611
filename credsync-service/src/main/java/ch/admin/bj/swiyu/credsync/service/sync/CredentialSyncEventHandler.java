/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@AllArgsConstructor
public class CredentialSyncEventHandler {

    private final CredentialPushService credentialPushService;

    /**
     * Runs on the task executor once the issuing transaction committed.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Async
    public void handleCredentialIssuedEvent(CredentialIssuedEvent event) {
        try {
            var outcome = credentialPushService.push(event.credential());
            log.debug("Processed CredentialIssuedEvent for credential {}: {}", event.credential().getId(), outcome.phase());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while pushing credential {}", event.credential().getId(), e);
        }
    }
}
