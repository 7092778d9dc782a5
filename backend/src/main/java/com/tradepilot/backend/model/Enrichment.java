package com.tradepilot.backend.model;

import java.util.List;
import java.util.Map;

public record Enrichment(List<String> headlines, Map<String, Object> attributes) {

    private static final Enrichment EMPTY = new Enrichment(List.of(), Map.of());

    public Enrichment {
        headlines = headlines == null ? List.of() : List.copyOf(headlines);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static Enrichment empty() {
        return EMPTY;
    }

    public static Enrichment ofHeadlines(List<String> headlines) {
        return new Enrichment(headlines, Map.of());
    }

    public boolean isEmpty() {
        return headlines.isEmpty() && attributes.isEmpty();
    }
}
