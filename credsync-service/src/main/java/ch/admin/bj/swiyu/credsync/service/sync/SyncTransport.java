/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.common.exception.SyncDeliveryException;

/**
 * Delivers a single credential to the verification service.
 */
public interface SyncTransport {

    /**
     * @throws SyncDeliveryException if the peer could not be reached or did not answer with 2xx
     */
    void deliver(CredentialDto credential);
}
