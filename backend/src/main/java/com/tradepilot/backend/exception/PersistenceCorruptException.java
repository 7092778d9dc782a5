package com.tradepilot.backend.exception;

public class PersistenceCorruptException extends TradingException {
    public PersistenceCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
