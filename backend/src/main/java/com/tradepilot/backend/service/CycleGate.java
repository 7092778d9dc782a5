package com.tradepilot.backend.service;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.repository.CycleMarkerRepository;
import com.tradepilot.backend.util.TradingCalendar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admits at most one decision cycle at a time and enforces the minimum number
 * of trading days between completed cycles. A successful {@link #tryAcquire}
 * must be paired with {@link #release}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CycleGate {

    private final CycleMarkerRepository cycleMarkerRepository;
    private final StrategyProperties strategyProperties;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    public GateDecision tryAcquire(LocalDate date) {
        if (!TradingCalendar.isTradingDay(date)) {
            return GateDecision.reject(date.getDayOfWeek() + " is not a trading day");
        }
        if (!inFlight.compareAndSet(false, true)) {
            return GateDecision.reject("A decision cycle is already running");
        }
        Optional<LocalDate> lastRun = cycleMarkerRepository.findLastRun();
        int minDays = strategyProperties.getCycle().getMinTradingDaysBetweenRuns();
        if (lastRun.isPresent() && TradingCalendar.tradingDaysBetween(lastRun.get(), date) < minDays) {
            inFlight.set(false);
            return GateDecision.reject("Last cycle ran on " + lastRun.get()
                    + ", fewer than " + minDays + " trading days ago");
        }
        return GateDecision.allow();
    }

    /**
     * Frees the gate; the marker only advances for cycles that ran to completion.
     */
    public void release(LocalDate date, boolean completed) {
        try {
            if (completed) {
                cycleMarkerRepository.saveLastRun(date);
            }
        } catch (RuntimeException ex) {
            log.error("Failed to persist cycle marker for {}", date, ex);
        } finally {
            inFlight.set(false);
        }
    }

    public boolean isRunning() {
        return inFlight.get();
    }
}
