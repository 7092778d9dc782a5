package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.Enrichment;

public interface EnrichmentProvider {

    Enrichment fetch(String ticker);
}
