package com.tradepilot.backend.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A merged, ranked ticker handed to the decision stage.
 *
 * @param score   sum of the contributing hits' scores
 * @param sources contributing hits in source priority order
 */
public record Candidate(
        String ticker,
        double score,
        List<SourceHit> sources,
        Enrichment enrichment
) {
    public Candidate {
        sources = sources == null ? List.of() : List.copyOf(sources);
        enrichment = enrichment == null ? Enrichment.empty() : enrichment;
        score = Math.max(0.0, score);
    }

    public Set<String> sourceNames() {
        Set<String> names = new LinkedHashSet<>();
        sources.forEach(hit -> names.add(hit.source()));
        return names;
    }

    public boolean isMultiSource() {
        return sourceNames().size() >= 2;
    }

    public Candidate withEnrichment(Enrichment value) {
        return new Candidate(ticker, score, sources, value);
    }
}
