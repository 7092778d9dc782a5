package com.tradepilot.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class CooldownStatusResponse {
    private String ticker;
    private LocalDate lastBought;
    private boolean blocked;
    private long remainingDays;
}
