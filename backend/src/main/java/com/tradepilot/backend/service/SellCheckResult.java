package com.tradepilot.backend.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record SellCheckResult(
        LocalDate runDate,
        boolean dryRun,
        Map<String, List<SellExecution>> executions,
        List<String> errors
) {
    public long signalCount() {
        return executions.values().stream().mapToLong(List::size).sum();
    }
}
