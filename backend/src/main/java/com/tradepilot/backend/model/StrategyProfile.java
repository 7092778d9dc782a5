package com.tradepilot.backend.model;

import com.tradepilot.backend.util.MoneyUtils;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Budget, risk thresholds and target account of one trading strategy.
 * Consumed as-is by the trade executor and the sell rule engine.
 */
@Builder
public record StrategyProfile(
        String name,
        String accountId,
        double budgetPerRun,
        Integer maxPicksPerRun,
        double minTradeUnit,
        double stopLossPct,
        double takeProfitPct,
        int maxHoldDays
) {
    public BigDecimal budget() {
        return MoneyUtils.bd(budgetPerRun);
    }

    public BigDecimal minimumTradeUnit() {
        return MoneyUtils.bd(minTradeUnit);
    }
}
