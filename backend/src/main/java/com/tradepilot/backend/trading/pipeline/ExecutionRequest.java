package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.Pick;
import com.tradepilot.backend.model.StrategyProfile;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * @param maxAttempts  cap on orders submitted, null for no cap
 * @param listener     receives every result as soon as it is known, may be null
 * @param abortSignal  polled before each pick, may be null
 */
@Builder
public record ExecutionRequest(
        String accountId,
        List<Pick> picks,
        BigDecimal budget,
        Integer maxAttempts,
        BigDecimal minTradeUnit,
        LocalDate runDate,
        Consumer<TradeResult> listener,
        BooleanSupplier abortSignal
) {
    public ExecutionRequest {
        picks = picks == null ? List.of() : List.copyOf(picks);
    }

    public static ExecutionRequestBuilder forProfile(StrategyProfile profile) {
        return ExecutionRequest.builder()
                .accountId(profile.accountId())
                .budget(profile.budget())
                .maxAttempts(profile.maxPicksPerRun())
                .minTradeUnit(profile.minimumTradeUnit());
    }
}
