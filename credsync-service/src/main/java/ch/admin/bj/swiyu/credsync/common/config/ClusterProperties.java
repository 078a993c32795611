/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the primary process supervising the workers.
 *
 * @param workerCount         number of worker processes, 1 runs the service in-process without supervision
 * @param shutdownGracePeriod time the workers get to drain before they are killed
 * @param minUptime           a worker exiting before this uptime counts as a rapid crash
 * @param rapidCrashThreshold consecutive rapid crashes tolerated before respawns are delayed
 * @param respawnBackoff      delay added per rapid crash beyond the threshold, also used to retry failed launches
 * @param maxRespawnBackoff   upper bound of the respawn delay
 */
@Validated
@ConfigurationProperties(prefix = "cluster")
public record ClusterProperties(
        @Min(value = 1, message = "At least one worker is required") @DefaultValue("1") int workerCount,
        @NotNull @DefaultValue("PT10S") Duration shutdownGracePeriod,
        @NotNull @DefaultValue("PT5S") Duration minUptime,
        @Min(1) @DefaultValue("3") int rapidCrashThreshold,
        @NotNull @DefaultValue("PT1S") Duration respawnBackoff,
        @NotNull @DefaultValue("PT30S") Duration maxRespawnBackoff) {
}
