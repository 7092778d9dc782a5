package com.tradepilot.backend.service;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.exception.OrderRejectedException;
import com.tradepilot.backend.model.Position;
import com.tradepilot.backend.model.SellSignal;
import com.tradepilot.backend.model.StrategyProfile;
import com.tradepilot.backend.service.broker.BrokerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks every open position of every active profile against its exit rules
 * and submits the resulting sell orders.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SellCheckService {

    private final BrokerPort brokerPort;
    private final SellRuleEngine sellRuleEngine;
    private final StrategyProperties strategyProperties;
    private final MetricsService metricsService;
    private final Clock clock;

    public SellCheckResult runSellChecks(boolean dryRun) {
        return runSellChecks(LocalDate.now(clock), dryRun);
    }

    public SellCheckResult runSellChecks(LocalDate today, boolean dryRun) {
        Map<String, List<SellExecution>> executions = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        for (StrategyProfile profile : strategyProperties.activeProfiles()) {
            List<Position> positions;
            try {
                positions = brokerPort.openPositions(profile.accountId());
            } catch (RuntimeException ex) {
                log.warn("Sell check for profile {} skipped: positions unavailable", profile.name(), ex);
                errors.add(profile.name() + ": positions unavailable: " + ex.getMessage());
                continue;
            }
            List<SellSignal> signals = sellRuleEngine.evaluateAll(positions, prices(positions), today, profile);
            List<SellExecution> profileExecutions = new ArrayList<>();
            for (SellSignal signal : signals) {
                metricsService.recordSellSignal(signal.rule().name());
                log.info("Sell signal for {} ({}): {}", signal.ticker(), profile.name(), signal.reason());
                profileExecutions.add(dryRun
                        ? new SellExecution(signal, false, null, "dry run")
                        : submit(signal));
            }
            executions.put(profile.name(), profileExecutions);
        }
        SellCheckResult result = new SellCheckResult(today, dryRun, executions, errors);
        log.info("Sell checks for {} finished: {} signals{}", today, result.signalCount(), dryRun ? " (dry run)" : "");
        return result;
    }

    private SellExecution submit(SellSignal signal) {
        try {
            String instrument = brokerPort.resolveInstrument(signal.ticker()).orElse(signal.ticker());
            BrokerPort.OrderFill fill = brokerPort.placeSellOrder(signal.accountId(), instrument, signal.quantity());
            metricsService.incrementSellOrdersPlaced();
            return new SellExecution(signal, true, fill == null ? null : fill.orderId(), "submitted");
        } catch (OrderRejectedException ex) {
            log.warn("Sell order for {} rejected: {}", signal.ticker(), ex.getMessage());
            return new SellExecution(signal, false, null, "rejected: " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Sell order for {} failed", signal.ticker(), ex);
            return new SellExecution(signal, false, null, "failed: " + ex.getMessage());
        }
    }

    private Map<String, BigDecimal> prices(List<Position> positions) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        for (Position position : positions) {
            try {
                Optional<BigDecimal> price = brokerPort.resolveInstrument(position.ticker())
                        .flatMap(brokerPort::currentPrice);
                price.ifPresent(value -> prices.put(position.ticker(), value));
            } catch (RuntimeException ex) {
                log.warn("Price lookup for {} failed: {}", position.ticker(), ex.getMessage());
            }
        }
        return prices;
    }
}
