/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import ch.admin.bj.swiyu.credsync.common.config.ClusterProperties;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Optional;

/**
 * Entry point shared by both services.
 * <ul>
 *     <li>started by the primary with {@value WorkerIdentity#WORKER_ID_ENV} set: run the service as worker</li>
 *     <li>{@code cluster.worker-count} of 1: run the service in this process</li>
 *     <li>otherwise: become the primary and supervise the workers until terminated</li>
 * </ul>
 */
@Slf4j
@UtilityClass
public class ClusterBootstrap {

    /**
     * @return the service context if this process serves requests, empty for the primary once all workers stopped
     */
    public static Optional<ConfigurableApplicationContext> run(Class<?> applicationClass, String[] args) {
        var workerIdentity = WorkerIdentity.fromEnvironment();
        if (workerIdentity.isPresent()) {
            return Optional.of(runWorker(applicationClass, args));
        }

        var primaryContext = new SpringApplicationBuilder(ClusterPrimaryConfiguration.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .initializers(context -> context.getBeanFactory()
                        .registerSingleton("workerCommand", WorkerCommand.forCurrentJvm(applicationClass, args)))
                .run(args);

        var clusterProperties = primaryContext.getBean(ClusterProperties.class);
        if (clusterProperties.workerCount() == 1) {
            primaryContext.close();
            log.info("Running {} as a single process", applicationClass.getSimpleName());
            return Optional.of(SpringApplication.run(applicationClass, args));
        }

        var supervisor = primaryContext.getBean(ClusterSupervisor.class);
        supervisor.start(clusterProperties.workerCount());
        supervisor.awaitTermination();
        return Optional.empty();
    }

    private static ConfigurableApplicationContext runWorker(Class<?> applicationClass, String[] args) {
        var context = SpringApplication.run(applicationClass, args);
        WorkerControlChannel.forCurrentProcess()
                .listenForStop(() -> System.exit(SpringApplication.exit(context)));
        return context;
    }
}
