/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync;

import ch.admin.bj.swiyu.credsync.cluster.ClusterBootstrap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.env.Environment;

@SpringBootApplication
@EnableConfigurationProperties
@ConfigurationPropertiesScan
@Slf4j
public class VerificationApplication {

    public static void main(String[] args) {
        ClusterBootstrap.run(VerificationApplication.class, args).ifPresent(context -> {
            Environment env = context.getEnvironment();
            log.info(
                    """

                            ----------------------------------------------------------------------------
                            \t'{}' is running!\s
                            \tProfile(s): \t\t\t\t{}
                            \tSwaggerUI:   \t\t\t\thttp://localhost:{}/swagger-ui.html
                            ----------------------------------------------------------------------------""",
                    env.getProperty("spring.application.name"),
                    env.getActiveProfiles(),
                    env.getProperty("server.port")
            );
        });
    }
}
