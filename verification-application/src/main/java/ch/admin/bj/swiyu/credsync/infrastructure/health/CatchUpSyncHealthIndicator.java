/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.health;

import ch.admin.bj.swiyu.credsync.infrastructure.scheduler.CatchUpSyncStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes the last catch-up outcome. A failed catch-up is reported as detail only, the worker still
 * serves verifications from what it has.
 */
@Component("catchUpSync")
@RequiredArgsConstructor
public class CatchUpSyncHealthIndicator implements HealthIndicator {

    private final CatchUpSyncStatus catchUpSyncStatus;

    @Override
    public Health health() {
        return catchUpSyncStatus.getLastOutcome()
                .map(outcome -> {
                    var builder = Health.up()
                            .withDetail("lastRunSucceeded", outcome.succeeded())
                            .withDetail("finishedAt", outcome.finishedAt().toString())
                            .withDetail("storedCredentials", outcome.storedCredentials());
                    if (outcome.error() != null) {
                        builder.withDetail("error", outcome.error());
                    }
                    return builder.build();
                })
                .orElseGet(() -> Health.unknown().withDetail("lastRunSucceeded", "not run yet").build());
    }
}
