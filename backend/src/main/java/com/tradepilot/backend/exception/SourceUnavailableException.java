package com.tradepilot.backend.exception;

import lombok.Getter;

/**
 * Raised by a signal source that cannot deliver its feed for the current cycle.
 * The merge excludes that source and continues with the others.
 */
@Getter
public class SourceUnavailableException extends TradingException {

    private final String source;

    public SourceUnavailableException(String source, String message) {
        super(message);
        this.source = source;
    }

    public SourceUnavailableException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }
}
