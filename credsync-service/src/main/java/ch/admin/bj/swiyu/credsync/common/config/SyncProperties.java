/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.config;

import jakarta.annotation.Nullable;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Settings of the synchronization between the issuance and the verification service.
 *
 * @param peerUrl        base url of the other service
 * @param secret         shared secret sent in {@code secretHeader}, the check is disabled when blank
 * @param maxAttempts    number of push attempts before giving up
 * @param baseDelay      linear backoff base, the wait after failed attempt n is {@code n * baseDelay}
 * @param connectTimeout connect timeout of calls to the peer
 * @param readTimeout    read timeout of calls to the peer
 */
@Validated
@ConfigurationProperties(prefix = "sync")
public record SyncProperties(
        @NotNull URI peerUrl,
        @Nullable String secret,
        @NotBlank @DefaultValue("x-internal-sync-key") String secretHeader,
        @Min(1) @DefaultValue("3") int maxAttempts,
        @NotNull @DefaultValue("PT0.2S") Duration baseDelay,
        @NotNull @DefaultValue("PT5S") Duration connectTimeout,
        @NotNull @DefaultValue("PT10S") Duration readTimeout,
        @NotNull @Valid @DefaultValue CatchUp catchUp) {

    public boolean hasSecret() {
        return StringUtils.isNotBlank(secret);
    }

    /**
     * @param enabled         run a catch-up when the service starts
     * @param periodicEnabled additionally run the catch-up every {@code interval}
     */
    public record CatchUp(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("false") boolean periodicEnabled,
            @NotNull @DefaultValue("PT5M") Duration interval) {
    }
}
