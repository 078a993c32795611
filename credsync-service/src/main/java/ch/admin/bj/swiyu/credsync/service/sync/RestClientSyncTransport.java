/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.common.exception.SyncDeliveryException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
@RequiredArgsConstructor
public class RestClientSyncTransport implements SyncTransport {

    static final String SYNC_PATH = "/internal/sync";

    private final RestClient syncRestClient;

    @Override
    public void deliver(CredentialDto credential) {
        try {
            syncRestClient.post()
                    .uri(SYNC_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(credential)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (request, response) -> {
                        throw new SyncDeliveryException("Verification service responded with status %s".formatted(response.getStatusCode().value()));
                    })
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new SyncDeliveryException("Verification service not reachable: %s".formatted(e.getMessage()), e);
        }
    }
}
