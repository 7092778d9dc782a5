package com.tradepilot.backend.trading.pipeline;

import java.math.BigDecimal;

/**
 * Outcome of one pick. {@code reason} is null for bought tickers.
 */
public record TradeResult(
        String ticker,
        TradeStatus status,
        FailureReason reason,
        String message,
        BigDecimal requestedAmount,
        BigDecimal filledAmount,
        BigDecimal filledQuantity,
        String instrument,
        String orderId
) {
    public static TradeResult bought(String ticker, BigDecimal requested, BigDecimal filled,
                                     BigDecimal quantity, String instrument, String orderId) {
        return new TradeResult(ticker, TradeStatus.BOUGHT, null, "bought", requested, filled, quantity, instrument, orderId);
    }

    public static TradeResult failed(String ticker, FailureReason reason, String message,
                                     BigDecimal requested, String instrument) {
        return new TradeResult(ticker, TradeStatus.FAILED, reason, message, requested, null, null, instrument, null);
    }

    public static TradeResult skipped(String ticker, FailureReason reason, String message) {
        return new TradeResult(ticker, TradeStatus.SKIPPED, reason, message, null, null, null, null, null);
    }

    public boolean isBought() {
        return status == TradeStatus.BOUGHT;
    }
}
