package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.BuyEvent;

import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate insider conviction for one ticker.
 *
 * @param score        sum of the decayed event scores inside the lookback window
 * @param insiderCount distinct insiders behind {@code events}
 */
public record ConvictionScore(
        String ticker,
        double score,
        int insiderCount,
        boolean csuiteBuyer,
        LocalDate latestTradeDate,
        double totalValueUsd,
        List<BuyEvent> events
) {
    public boolean isCluster() {
        return insiderCount >= 2;
    }
}
