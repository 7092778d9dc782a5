package com.tradepilot.backend.model;

import java.time.LocalDate;

public record CooldownEntry(String ticker, LocalDate lastBought) {}
