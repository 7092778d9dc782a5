package com.tradepilot.backend.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Position(
        String ticker,
        BigDecimal quantity,
        BigDecimal averagePrice,
        LocalDate openDate,
        String accountId
) {}
