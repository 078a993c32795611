/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.infrastructure.scheduler;

import ch.admin.bj.swiyu.credsync.common.config.SyncProperties;
import ch.admin.bj.swiyu.credsync.service.sync.CatchUpSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Pulls the credentials missed while the verification service was down or a push failed.
 *
 * <p>Runs once when the service started and, if {@code sync.catch-up.periodic-enabled} is set, every
 * {@code sync.catch-up.interval}. The periodic run uses a distributed lock ("catchUpSync") so only one
 * worker performs it. A failing catch-up is logged and never stops the service.</p>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CatchUpSyncScheduler implements ApplicationRunner {

    private final CatchUpSyncService catchUpSyncService;
    private final CatchUpSyncStatus catchUpSyncStatus;
    private final SyncProperties syncProperties;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        if (!syncProperties.catchUp().enabled()) {
            log.info("Catch-up sync on startup disabled");
            return;
        }
        catchUp("startup");
    }

    @Scheduled(initialDelayString = "${sync.catch-up.interval}", fixedDelayString = "${sync.catch-up.interval}")
    @SchedulerLock(name = "catchUpSync")
    public void catchUpPeriodically() {
        if (!syncProperties.catchUp().periodicEnabled()) {
            return;
        }
        catchUp("schedule");
    }

    void catchUp(String trigger) {
        try {
            var stored = catchUpSyncService.performCatchUpSync();
            catchUpSyncStatus.recordSuccess(Instant.now(clock), stored);
        } catch (RuntimeException e) {
            catchUpSyncStatus.recordFailure(Instant.now(clock), e);
            log.error("Catch-up sync ({}) failed: {}", trigger, e.getMessage(), e);
        }
    }
}
