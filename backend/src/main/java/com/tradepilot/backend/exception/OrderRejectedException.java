package com.tradepilot.backend.exception;

import lombok.Getter;

@Getter
public class OrderRejectedException extends TradingException {

    private final String ticker;

    public OrderRejectedException(String ticker, String message) {
        super(message);
        this.ticker = ticker;
    }
}
