package com.tradepilot.backend.service;

import com.tradepilot.backend.trading.pipeline.ExecutionSummary;
import com.tradepilot.backend.trading.pipeline.MergeResult;
import com.tradepilot.backend.trading.pipeline.TradeResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State shared between the cycle worker and the thread waiting on it, so a
 * timed-out cycle can still report what happened before the abort.
 */
class CycleProgress {

    private volatile boolean aborted;
    private MergeResult merge = MergeResult.empty();
    private final Map<String, ExecutionSummary> summaries = new LinkedHashMap<>();
    private final Map<String, List<TradeResult>> results = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    void abort() {
        aborted = true;
    }

    boolean isAborted() {
        return aborted;
    }

    synchronized void mergeDone(MergeResult value) {
        merge = value;
    }

    synchronized void tradeResult(String profile, TradeResult result) {
        results.computeIfAbsent(profile, key -> new ArrayList<>()).add(result);
    }

    synchronized void profileDone(String profile, ExecutionSummary summary) {
        summaries.put(profile, summary);
    }

    synchronized void error(String message) {
        errors.add(message);
    }

    synchronized MergeResult merge() {
        return merge;
    }

    synchronized Map<String, ExecutionSummary> summaries() {
        return new LinkedHashMap<>(summaries);
    }

    synchronized Map<String, List<TradeResult>> results() {
        Map<String, List<TradeResult>> copy = new LinkedHashMap<>();
        results.forEach((profile, list) -> copy.put(profile, List.copyOf(list)));
        return copy;
    }

    synchronized List<String> errors() {
        return List.copyOf(errors);
    }

    synchronized boolean anyBought() {
        return results.values().stream().flatMap(List::stream).anyMatch(TradeResult::isBought);
    }
}
