/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.api.credential.CredentialDto;
import ch.admin.bj.swiyu.credsync.api.credential.CredentialListResponseDto;
import ch.admin.bj.swiyu.credsync.common.date.TimeUtils;
import ch.admin.bj.swiyu.credsync.common.exception.SyncProtocolException;
import jakarta.annotation.Nullable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.List;

/**
 * Pulls the credentials the verification service missed from the issuance service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IssuanceCatchUpClient {

    static final String LISTING_PATH = "/internal/credentials";
    static final String INVALID_RESPONSE_MESSAGE = "Invalid response from issuance service";

    private final RestClient syncRestClient;

    /**
     * @param since exclusive cursor, null fetches everything
     * @throws SyncProtocolException if the issuance service is unreachable or answers outside the contract
     */
    public List<CredentialDto> fetchIssuedAfter(@Nullable Instant since) {
        CredentialListResponseDto response;
        try {
            response = syncRestClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path(LISTING_PATH);
                        if (since != null) {
                            uriBuilder.queryParam("since", TimeUtils.instantToIsoMillis(since));
                        }
                        return uriBuilder.build();
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (request, clientResponse) -> {
                        throw new SyncProtocolException("Issuance service responded with status %s".formatted(clientResponse.getStatusCode().value()));
                    })
                    .body(CredentialListResponseDto.class);
        } catch (ResourceAccessException e) {
            throw new SyncProtocolException("Issuance service not reachable", e);
        } catch (RestClientException e) {
            // body not matching the listing contract, e.g. data not being an array
            throw new SyncProtocolException(INVALID_RESPONSE_MESSAGE, e);
        }

        if (response == null || !response.success() || response.data() == null) {
            throw new SyncProtocolException(INVALID_RESPONSE_MESSAGE);
        }
        log.debug("Issuance service returned {} credential(s) issued after {}", response.data().size(), since);
        return response.data();
    }
}
