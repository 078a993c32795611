/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.config;

import ch.admin.bj.swiyu.credsync.cluster.WorkerIdentity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@Data
@ConfigurationProperties(prefix = "application")
public class ApplicationProperties {

    private static final String WORKER_LABEL_PREFIX = "worker-";

    /**
     * Identifier used for the worker label when the service does not run under the cluster supervisor.
     * Usually the host name.
     */
    @NotBlank
    private String workerId;

    @NotNull
    private List<String> corsAllowedOrigins = List.of();

    /**
     * Label stamped as issuer or verifier on credentials handled by this process.
     * Inside a supervised worker this is {@code worker-<n>}, otherwise derived from {@link #workerId}.
     */
    public String getWorkerLabel() {
        return WorkerIdentity.fromEnvironment()
                .map(WorkerIdentity::label)
                .orElseGet(() -> workerId.startsWith(WORKER_LABEL_PREFIX) ? workerId : WORKER_LABEL_PREFIX + workerId);
    }
}
