package com.tradepilot.backend.service;

import com.tradepilot.backend.model.SellSignal;

/**
 * A sell signal and what happened to its order. {@code submitted} is false for
 * dry runs and failed submissions.
 */
public record SellExecution(SellSignal signal, boolean submitted, String orderId, String message) {}
