/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.common.config.SyncProperties;
import ch.admin.bj.swiyu.credsync.common.exception.SyncUnauthorizedException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the internal endpoints with the shared secret. Without a configured secret every caller is accepted.
 */
@Component
@RequiredArgsConstructor
public class SyncSecretVerifier {

    private final SyncProperties syncProperties;

    public void verify(HttpHeaders headers, String unauthorizedMessage) {
        if (!syncProperties.hasSecret()) {
            return;
        }
        var presented = headers.getFirst(syncProperties.secretHeader());
        if (presented == null || !MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                syncProperties.secret().getBytes(StandardCharsets.UTF_8))) {
            throw new SyncUnauthorizedException(unauthorizedMessage);
        }
    }
}
