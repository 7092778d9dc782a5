package com.tradepilot.backend.model;

/**
 * Exit rules in evaluation priority; the first rule that matches wins.
 */
public enum ExitRule {
    STOP_LOSS,
    TAKE_PROFIT,
    HOLD_PERIOD
}
