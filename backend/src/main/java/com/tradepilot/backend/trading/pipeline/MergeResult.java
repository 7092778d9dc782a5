package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.Candidate;

import java.util.List;

public record MergeResult(
        List<Candidate> candidates,
        List<String> unavailableSources,
        List<String> blockedTickers
) {
    public static MergeResult empty() {
        return new MergeResult(List.of(), List.of(), List.of());
    }
}
