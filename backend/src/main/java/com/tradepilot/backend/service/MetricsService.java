package com.tradepilot.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter ordersPlacedCounter;
    private Counter sellOrdersPlacedCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        sellOrdersPlacedCounter = Counter.builder("sell_orders_placed_total").register(meterRegistry);
    }

    public void recordCycle(String status) {
        Counter.builder("decision_cycles_total")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }

    public void incrementOrdersPlaced() {
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void recordOrderFailure(String reason) {
        Counter.builder("orders_failed_total")
                .tag("reason", reason == null ? "unknown" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordSellSignal(String rule) {
        Counter.builder("sell_signals_total")
                .tag("rule", rule)
                .register(meterRegistry)
                .increment();
    }

    public void incrementSellOrdersPlaced() {
        if (sellOrdersPlacedCounter != null) {
            sellOrdersPlacedCounter.increment();
        }
    }

    public void recordSourceUnavailable(String source) {
        Counter.builder("signal_sources_unavailable_total")
                .tag("source", source)
                .register(meterRegistry)
                .increment();
    }

    public void recordTaskFailure(String task) {
        Counter.builder("scheduled_task_failures_total")
                .tag("task", task)
                .register(meterRegistry)
                .increment();
    }
}
