package com.tradepilot.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "strategy.cycle.scheduler-enabled", havingValue = "true")
public class DecisionCycleScheduler {

    private final DecisionCycleService decisionCycleService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(cron = "${strategy.cycle.cron}", zone = "${strategy.cycle.timezone}")
    public void runCycle() {
        scheduledTaskGuard.run("decision-cycle", () -> {
            CycleResult result = decisionCycleService.runCycle();
            log.info("Scheduled decision cycle finished with status {}", result.status());
        });
    }
}
