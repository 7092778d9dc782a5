package com.tradepilot.backend.trading.pipeline;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * @param availableCash cash reported by the venue, null when the lookup failed
 * @param overfilled    the venue filled more than was submitted, so {@code totalSpent}
 *                      exceeds {@code effectiveBudget}; submitted amounts never do
 */
public record ExecutionSummary(
        String accountId,
        BigDecimal budget,
        BigDecimal availableCash,
        BigDecimal effectiveBudget,
        BigDecimal totalSpent,
        List<TradeResult> bought,
        List<TradeResult> failed,
        List<TradeResult> skipped,
        StopReason stopReason,
        boolean overfilled
) {
    public ExecutionSummary {
        bought = List.copyOf(bought);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
    }

    public double budgetUtilisationPct() {
        if (budget == null || budget.signum() <= 0) {
            return 0.0;
        }
        return totalSpent.multiply(BigDecimal.valueOf(100))
                .divide(budget, 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public enum StopReason {
        PICKS_EXHAUSTED,
        BUDGET_EXHAUSTED,
        ATTEMPT_CAP_REACHED,
        INTERRUPTED
    }
}
