package com.tradepilot.backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "strategy.cycle.sell-check-scheduler-enabled", havingValue = "true")
public class SellCheckScheduler {

    private final SellCheckService sellCheckService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(cron = "${strategy.cycle.sell-check-cron}", zone = "${strategy.cycle.timezone}")
    public void runSellChecks() {
        scheduledTaskGuard.run("sell-checks", () -> sellCheckService.runSellChecks(false));
    }
}
