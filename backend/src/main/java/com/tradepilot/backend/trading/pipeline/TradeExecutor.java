package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.exception.OrderRejectedException;
import com.tradepilot.backend.model.Pick;
import com.tradepilot.backend.service.CooldownTracker;
import com.tradepilot.backend.service.broker.BrokerPort;
import com.tradepilot.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Spends a fixed budget on rank-ordered picks, one order at a time.
 *
 * <p>Remaining budget is shared state whose outcome depends on order, so picks
 * are never submitted in parallel. A pick that cannot be bought is recorded and
 * the next one is tried; nothing is retried within a run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutor {

    static final String NOT_TRADABLE_MESSAGE = "not tradable";

    private final BrokerPort brokerPort;
    private final CooldownTracker cooldownTracker;

    public ExecutionSummary execute(ExecutionRequest request) {
        BigDecimal budget = MoneyUtils.scale(Optional.ofNullable(request.budget()).orElse(BigDecimal.ZERO).max(BigDecimal.ZERO));
        BigDecimal minUnit = MoneyUtils.scale(Optional.ofNullable(request.minTradeUnit()).orElse(BigDecimal.ONE));

        List<TradeResult> bought = new ArrayList<>();
        List<TradeResult> failed = new ArrayList<>();
        List<TradeResult> skipped = new ArrayList<>();

        if (MoneyUtils.isBelow(budget, minUnit)) {
            log.info("Budget {} below minimum trade unit {} for account {}, nothing to do",
                    budget, minUnit, request.accountId());
            return new ExecutionSummary(request.accountId(), budget, null, budget, MoneyUtils.ZERO,
                    bought, failed, skipped, ExecutionSummary.StopReason.BUDGET_EXHAUSTED, false);
        }

        BigDecimal cash = lookupCash(request.accountId());
        BigDecimal effectiveBudget = cash == null ? budget : MoneyUtils.min(budget, cash.max(BigDecimal.ZERO));
        BigDecimal remaining = effectiveBudget;
        List<Pick> picks = request.picks().stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(Pick::rank))
                .toList();

        Set<String> handled = new HashSet<>();
        int attempts = 0;
        ExecutionSummary.StopReason stopReason = ExecutionSummary.StopReason.PICKS_EXHAUSTED;

        for (Pick pick : picks) {
            if (aborted(request)) {
                stopReason = ExecutionSummary.StopReason.INTERRUPTED;
                break;
            }
            if (MoneyUtils.isBelow(remaining, minUnit)) {
                stopReason = ExecutionSummary.StopReason.BUDGET_EXHAUSTED;
                break;
            }
            if (request.maxAttempts() != null && attempts >= request.maxAttempts()) {
                stopReason = ExecutionSummary.StopReason.ATTEMPT_CAP_REACHED;
                break;
            }

            String ticker = pick.ticker();
            if (ticker.isEmpty()) {
                publish(request, skipped, TradeResult.skipped(ticker, FailureReason.INVALID_TICKER, "blank ticker"));
                continue;
            }
            if (!handled.add(ticker)) {
                publish(request, skipped, TradeResult.skipped(ticker, FailureReason.DUPLICATE, "already handled this run"));
                continue;
            }
            BigDecimal spend = MoneyUtils.min(pick.requestedAmount(effectiveBudget), remaining);
            if (MoneyUtils.isBelow(spend, minUnit)) {
                publish(request, skipped, TradeResult.skipped(ticker, FailureReason.BELOW_MIN_UNIT,
                        "requested " + spend + " below minimum " + minUnit));
                continue;
            }

            attempts++;
            TradeResult result = attempt(request, ticker, spend);
            if (result.isBought()) {
                BigDecimal filled = result.filledAmount();
                if (filled.compareTo(remaining) > 0) {
                    log.warn("Venue filled {} for {} above remaining budget {}", filled, ticker, remaining);
                }
                remaining = MoneyUtils.subtract(remaining, filled).max(MoneyUtils.ZERO);
                if (aborted(request)) {
                    log.warn("Cycle aborted while buying {}; cooldown entry not committed", ticker);
                } else {
                    recordCooldown(request, ticker);
                }
                publish(request, bought, result);
                log.info("Bought {} for {} (remaining {})", ticker, filled, remaining);
            } else {
                publish(request, failed, result);
                log.info("Could not buy {}: {} ({})", ticker, result.reason(), result.message());
            }
        }

        BigDecimal spent = bought.stream()
                .map(TradeResult::filledAmount)
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
        log.info("Execution for {} finished: {} bought, {} failed, {} skipped, spent {} of {} ({})",
                request.accountId(), bought.size(), failed.size(), skipped.size(), spent, effectiveBudget, stopReason);
        boolean overfilled = spent.compareTo(effectiveBudget) > 0;
        if (overfilled) {
            log.warn("Venue fills for {} total {}, above the effective budget {}", request.accountId(), spent, effectiveBudget);
        }
        return new ExecutionSummary(request.accountId(), budget, cash, effectiveBudget, spent,
                bought, failed, skipped, stopReason, overfilled);
    }

    private TradeResult attempt(ExecutionRequest request, String ticker, BigDecimal spend) {
        Optional<String> instrument;
        try {
            instrument = brokerPort.resolveInstrument(ticker);
        } catch (RuntimeException ex) {
            log.warn("Tradability lookup for {} failed", ticker, ex);
            return TradeResult.failed(ticker, FailureReason.TRADABILITY_UNRESOLVED,
                    "tradability unresolved: " + ex.getMessage(), spend, null);
        }
        if (instrument.isEmpty()) {
            return TradeResult.failed(ticker, FailureReason.NOT_TRADABLE, NOT_TRADABLE_MESSAGE, spend, null);
        }
        String instrumentId = instrument.get();

        Optional<BigDecimal> price;
        try {
            price = brokerPort.currentPrice(instrumentId);
        } catch (RuntimeException ex) {
            log.warn("Price lookup for {} failed", instrumentId, ex);
            price = Optional.empty();
        }
        if (price.isEmpty() || !MoneyUtils.isPositive(price.get())) {
            return TradeResult.failed(ticker, FailureReason.NO_PRICE, "no valid price", spend, instrumentId);
        }

        try {
            BrokerPort.OrderFill fill = brokerPort.placeBuyOrder(request.accountId(), instrumentId, spend, price.get());
            BigDecimal filled = fill == null || fill.filledValue() == null ? spend : MoneyUtils.scale(fill.filledValue());
            return TradeResult.bought(ticker, spend, filled,
                    fill == null ? null : fill.filledQuantity(), instrumentId, fill == null ? null : fill.orderId());
        } catch (OrderRejectedException ex) {
            return TradeResult.failed(ticker, FailureReason.ORDER_REJECTED, ex.getMessage(), spend, instrumentId);
        } catch (RuntimeException ex) {
            log.warn("Order for {} failed", instrumentId, ex);
            return TradeResult.failed(ticker, FailureReason.BROKER_ERROR,
                    Objects.toString(ex.getMessage(), ex.getClass().getSimpleName()), spend, instrumentId);
        }
    }

    private BigDecimal lookupCash(String accountId) {
        try {
            BigDecimal cash = brokerPort.availableCash(accountId);
            return cash == null ? null : MoneyUtils.scale(cash);
        } catch (RuntimeException ex) {
            log.warn("Cash lookup for {} failed, using configured budget: {}", accountId, ex.getMessage());
            return null;
        }
    }

    private void recordCooldown(ExecutionRequest request, String ticker) {
        try {
            if (request.runDate() == null) {
                cooldownTracker.record(ticker);
            } else {
                cooldownTracker.record(ticker, request.runDate());
            }
        } catch (RuntimeException ex) {
            log.error("Failed to record cooldown for {}", ticker, ex);
        }
    }

    private static void publish(ExecutionRequest request, List<TradeResult> bucket, TradeResult result) {
        bucket.add(result);
        if (request.listener() != null) {
            request.listener().accept(result);
        }
    }

    private static boolean aborted(ExecutionRequest request) {
        return Thread.currentThread().isInterrupted()
                || (request.abortSignal() != null && request.abortSignal().getAsBoolean());
    }
}
