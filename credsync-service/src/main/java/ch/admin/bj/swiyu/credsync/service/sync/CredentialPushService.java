/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.common.config.SyncProperties;
import ch.admin.bj.swiyu.credsync.common.exception.SyncDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pushes freshly issued credentials to the verification service.
 * <p>
 * Delivery is attempted up to {@code sync.max-attempts} times, waiting {@code n * sync.base-delay}
 * after the failed attempt n. Credentials still missing afterwards are picked up by the catch-up
 * of the verification service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialPushService {

    private final SyncTransport syncTransport;
    private final SyncProperties syncProperties;
    private final Sleeper sleeper;

    /**
     * Never throws, the outcome is reported through the returned terminal state and the log.
     */
    public SyncRetryState push(CredentialDto credential) {
        var state = SyncRetryState.initial(syncProperties.maxAttempts());
        SyncDeliveryException lastError = null;

        while (!state.isTerminal()) {
            var delay = state.delayBeforeAttempt(syncProperties.baseDelay());
            if (!delay.isZero()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Push of credential {} interrupted before attempt {}", credential.getId(), state.attempt());
                    return state;
                }
            }
            try {
                syncTransport.deliver(credential);
                state = state.onSuccess();
            } catch (SyncDeliveryException e) {
                lastError = e;
                log.warn("Attempt {}/{} to sync credential {} failed: {}",
                        state.attempt(), state.maxAttempts(), credential.getId(), e.getMessage());
                state = state.onFailure();
            }
        }

        if (state.phase() == SyncRetryState.Phase.SUCCEEDED) {
            log.debug("Credential {} synced with verification service on attempt {}", credential.getId(), state.attempt());
        } else {
            log.error("Failed to sync credential {} with verification service after {} attempts",
                    credential.getId(), state.attempt(), lastError);
        }
        return state;
    }
}
