package com.tradepilot.backend.service;

import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.trading.pipeline.ExecutionSummary;
import com.tradepilot.backend.trading.pipeline.MergeResult;
import com.tradepilot.backend.trading.pipeline.TradeResult;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Structured outcome of one decision cycle.
 *
 * @param executions   summary per strategy profile that finished execution
 * @param tradeResults every trade result per profile, including those of an
 *                     execution cut short by a timeout
 */
public record CycleResult(
        CycleStatus status,
        LocalDate runDate,
        String reason,
        List<Candidate> candidates,
        List<String> unavailableSources,
        List<String> blockedTickers,
        Map<String, ExecutionSummary> executions,
        Map<String, List<TradeResult>> tradeResults,
        List<String> errors
) {
    public CycleResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        unavailableSources = unavailableSources == null ? List.of() : List.copyOf(unavailableSources);
        blockedTickers = blockedTickers == null ? List.of() : List.copyOf(blockedTickers);
        executions = executions == null ? Map.of() : executions;
        tradeResults = tradeResults == null ? Map.of() : tradeResults;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static CycleResult skipped(LocalDate date, String reason) {
        return new CycleResult(CycleStatus.SKIPPED, date, reason, null, null, null, null, null, null);
    }

    static CycleResult of(CycleStatus status, LocalDate date, String reason, CycleProgress progress) {
        MergeResult merge = progress.merge();
        return new CycleResult(status, date, reason, merge.candidates(), merge.unavailableSources(),
                merge.blockedTickers(), progress.summaries(), progress.results(), progress.errors());
    }
}
