package com.tradepilot.backend.model;

import java.util.List;

public record SourceFeed(String source, List<SourceHit> hits) {
    public SourceFeed {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }
}
