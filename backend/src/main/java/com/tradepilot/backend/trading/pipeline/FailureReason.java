package com.tradepilot.backend.trading.pipeline;

public enum FailureReason {
    INVALID_TICKER,
    DUPLICATE,
    BELOW_MIN_UNIT,
    NOT_TRADABLE,
    TRADABILITY_UNRESOLVED,
    NO_PRICE,
    ORDER_REJECTED,
    BROKER_ERROR
}
