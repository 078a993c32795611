/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.health;

import ch.admin.bj.swiyu.credsync.common.config.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Names the worker process answering the health request, useful to see the kernel spreading connections.
 */
@Component("worker")
@RequiredArgsConstructor
public class WorkerHealthIndicator implements HealthIndicator {

    private final ApplicationProperties applicationProperties;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("worker", applicationProperties.getWorkerLabel())
                .withDetail("pid", ProcessHandle.current().pid())
                .build();
    }
}
