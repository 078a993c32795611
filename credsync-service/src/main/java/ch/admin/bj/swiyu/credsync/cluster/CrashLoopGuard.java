/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import ch.admin.bj.swiyu.credsync.common.config.ClusterProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Slows respawning down when workers keep dying right after their start, e.g. because the database is down.
 * Not thread safe, owned by the supervisor thread.
 */
@Slf4j
class CrashLoopGuard {

    private final Duration minUptime;
    private final int rapidCrashThreshold;
    private final Duration respawnBackoff;
    private final Duration maxRespawnBackoff;
    private int consecutiveRapidCrashes;

    CrashLoopGuard(ClusterProperties properties) {
        this.minUptime = properties.minUptime();
        this.rapidCrashThreshold = properties.rapidCrashThreshold();
        this.respawnBackoff = properties.respawnBackoff();
        this.maxRespawnBackoff = properties.maxRespawnBackoff();
    }

    /**
     * @return delay before the replacement of the exited worker is started
     */
    Duration recordExit(Duration uptime) {
        if (uptime.compareTo(minUptime) >= 0) {
            consecutiveRapidCrashes = 0;
            return Duration.ZERO;
        }

        consecutiveRapidCrashes++;
        if (consecutiveRapidCrashes < rapidCrashThreshold) {
            log.warn("Worker exited {} after start, {} rapid crash(es) in a row", uptime, consecutiveRapidCrashes);
            return Duration.ZERO;
        }

        var delay = respawnBackoff.multipliedBy(consecutiveRapidCrashes - rapidCrashThreshold + 1L);
        if (delay.compareTo(maxRespawnBackoff) > 0) {
            delay = maxRespawnBackoff;
        }
        log.warn("Workers are crash looping ({} exits within {} of start in a row), delaying respawn by {}",
                consecutiveRapidCrashes, minUptime, delay);
        return delay;
    }

    Duration launchRetryDelay() {
        return respawnBackoff;
    }

    int getConsecutiveRapidCrashes() {
        return consecutiveRapidCrashes;
    }
}
