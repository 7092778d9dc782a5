package com.tradepilot.backend.model;

import java.math.BigDecimal;

public record SellSignal(
        String ticker,
        String accountId,
        ExitRule rule,
        BigDecimal currentPrice,
        BigDecimal entryPrice,
        BigDecimal returnPct,
        long daysHeld,
        BigDecimal quantity,
        String reason
) {}
