package com.tradepilot.backend.model;

import java.time.LocalDate;
import java.util.Locale;

/**
 * A single open-market insider purchase as reported by the filings collector.
 *
 * @param stakeIncreasePct increase of the insider's holding in percent; a newly opened position is 100
 */
public record BuyEvent(
        String ticker,
        String insiderId,
        String insiderTitle,
        double stakeIncreasePct,
        LocalDate tradeDate,
        double valueUsd
) {
    public static final double NEW_POSITION_PCT = 100.0;

    public BuyEvent {
        ticker = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        insiderId = insiderId == null ? "" : insiderId.trim();
        insiderTitle = insiderTitle == null ? "" : insiderTitle.trim();
        if (Double.isNaN(stakeIncreasePct) || stakeIncreasePct < 0) {
            stakeIncreasePct = 0.0;
        }
    }

    public static BuyEvent newPosition(String ticker, String insiderId, String insiderTitle,
                                       LocalDate tradeDate, double valueUsd) {
        return new BuyEvent(ticker, insiderId, insiderTitle, NEW_POSITION_PCT, tradeDate, valueUsd);
    }
}
