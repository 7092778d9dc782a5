package com.tradepilot.backend.model;

import com.tradepilot.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * A ranked buy instruction from the decision stage. Either {@code allocationPct}
 * (share of the run budget) or {@code amount} (absolute) is set; absolute wins.
 */
public record Pick(
        String ticker,
        Double allocationPct,
        BigDecimal amount,
        int rank
) {
    public Pick {
        ticker = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }

    public static Pick ofPercent(String ticker, double allocationPct, int rank) {
        return new Pick(ticker, allocationPct, null, rank);
    }

    public static Pick ofAmount(String ticker, BigDecimal amount, int rank) {
        return new Pick(ticker, null, amount, rank);
    }

    public BigDecimal requestedAmount(BigDecimal budget) {
        if (amount != null) {
            return MoneyUtils.scale(amount.max(BigDecimal.ZERO));
        }
        double pct = allocationPct == null ? 100.0 : Math.max(0.0, allocationPct);
        return MoneyUtils.percentOf(budget, pct);
    }

    public Pick withAllocationPct(double pct) {
        return new Pick(ticker, pct, amount, rank);
    }
}
