/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Create sync events to be processed asynchronously
 */
@RequiredArgsConstructor
@Service
public class CredentialSyncEventProducer {
    private final ApplicationEventPublisher applicationEventPublisher;

    public void produceCredentialIssuedEvent(CredentialDto credential) {
        applicationEventPublisher.publishEvent(new CredentialIssuedEvent(credential));
    }
}
