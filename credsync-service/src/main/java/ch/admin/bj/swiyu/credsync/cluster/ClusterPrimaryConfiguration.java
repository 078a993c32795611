/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import ch.admin.bj.swiyu.credsync.common.config.ClusterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Context of the primary process. It only binds the cluster settings and holds the supervisor,
 * no datasource and no web server.
 * <p>
 * Not a component, only the primary process creates it.
 */
@Slf4j
@EnableConfigurationProperties(ClusterProperties.class)
public class ClusterPrimaryConfiguration {

    @Bean
    public WorkerLauncher workerLauncher(WorkerCommand workerCommand) {
        return new ProcessWorkerLauncher(workerCommand);
    }

    @Bean(destroyMethod = "shutdownAndAwait")
    public ClusterSupervisor clusterSupervisor(WorkerLauncher workerLauncher, ClusterProperties clusterProperties) {
        return new ClusterSupervisor(workerLauncher, clusterProperties,
                () -> log.info("All {} workers are ready", clusterProperties.workerCount()));
    }
}
