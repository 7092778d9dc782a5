package com.tradepilot.backend.trading.pipeline;

public enum TradeStatus {
    BOUGHT,
    FAILED,
    SKIPPED
}
