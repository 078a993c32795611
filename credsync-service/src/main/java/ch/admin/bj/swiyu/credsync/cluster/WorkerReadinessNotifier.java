/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Tells the primary a worker accepts connections once its web server is bound.
 */
@Slf4j
@Component
public class WorkerReadinessNotifier implements ApplicationListener<WebServerInitializedEvent> {

    private final Optional<WorkerIdentity> workerIdentity;
    private final WorkerControlChannel controlChannel;

    public WorkerReadinessNotifier() {
        this(WorkerIdentity.fromEnvironment(), WorkerControlChannel.forCurrentProcess());
    }

    WorkerReadinessNotifier(Optional<WorkerIdentity> workerIdentity, WorkerControlChannel controlChannel) {
        this.workerIdentity = workerIdentity;
        this.controlChannel = controlChannel;
    }

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        // the management server has its own namespace
        if (event.getApplicationContext().getServerNamespace() != null || workerIdentity.isEmpty()) {
            return;
        }
        log.info("{} listening on port {}", workerIdentity.get().label(), event.getWebServer().getPort());
        controlChannel.sendReady();
    }
}
