package com.tradepilot.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "broker")
@Data
@Validated
public class BrokerProperties {

    private String mode = "paper";
    @Valid
    private Paper paper = new Paper();

    @Data
    public static class Paper {
        @PositiveOrZero
        private BigDecimal startingCash = BigDecimal.valueOf(1000);
        /**
         * Tradable tickers and their quotes; anything else is not tradable.
         */
        private Map<String, BigDecimal> prices = new LinkedHashMap<>();
    }
}
