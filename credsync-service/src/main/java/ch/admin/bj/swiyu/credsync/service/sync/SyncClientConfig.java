/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.service.sync;

import ch.admin.bj.swiyu.credsync.common.config.SyncProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class SyncClientConfig {

    @Bean
    public RestClient syncRestClient(RestClient.Builder builder, SyncProperties syncProperties) {
        return createSyncRestClient(builder, syncProperties);
    }

    @Bean
    public Sleeper sleeper() {
        return duration -> Thread.sleep(duration.toMillis());
    }

    /**
     * Client bound to the peer service, sending the shared secret with every request when one is configured.
     */
    public static RestClient createSyncRestClient(RestClient.Builder builder, SyncProperties syncProperties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(syncProperties.connectTimeout());
        requestFactory.setReadTimeout(syncProperties.readTimeout());

        builder = builder
                .baseUrl(syncProperties.peerUrl().toString())
                .requestFactory(requestFactory);
        if (syncProperties.hasSecret()) {
            builder = builder.defaultHeader(syncProperties.secretHeader(), syncProperties.secret());
        }
        return builder.build();
    }
}
