/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import org.eclipse.jetty.server.ServerConnector;
import org.springframework.boot.web.embedded.jetty.JettyServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lets all workers bind the same port, the kernel then spreads incoming connections across them.
 */
@Component
public class ReusePortWebServerCustomizer implements WebServerFactoryCustomizer<JettyServletWebServerFactory> {

    private final Optional<WorkerIdentity> workerIdentity;

    public ReusePortWebServerCustomizer() {
        this(WorkerIdentity.fromEnvironment());
    }

    ReusePortWebServerCustomizer(Optional<WorkerIdentity> workerIdentity) {
        this.workerIdentity = workerIdentity;
    }

    @Override
    public void customize(JettyServletWebServerFactory factory) {
        if (workerIdentity.isEmpty()) {
            return;
        }
        factory.addServerCustomizers(server -> Arrays.stream(server.getConnectors())
                .filter(ServerConnector.class::isInstance)
                .map(ServerConnector.class::cast)
                .forEach(connector -> connector.setReusePort(true)));
    }
}
