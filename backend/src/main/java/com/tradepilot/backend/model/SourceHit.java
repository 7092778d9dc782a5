package com.tradepilot.backend.model;

import java.util.Locale;
import java.util.Map;

/**
 * One ticker surfaced by one signal source.
 *
 * @param rank     position within the source's own ranking, 0 is best
 * @param score    source-specific strength, never negative
 * @param evidence source-specific payload kept for the decision stage
 */
public record SourceHit(
        String ticker,
        String source,
        int rank,
        double score,
        Map<String, Object> evidence
) {
    public SourceHit {
        ticker = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        source = source == null ? "" : source.trim().toLowerCase(Locale.ROOT);
        if (Double.isNaN(score) || score < 0) {
            score = 0.0;
        }
        evidence = evidence == null ? Map.of() : Map.copyOf(evidence);
    }

    public static SourceHit of(String ticker, String source, int rank) {
        return new SourceHit(ticker, source, rank, 0.0, Map.of());
    }
}
