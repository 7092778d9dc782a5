package com.tradepilot.backend.service;

import com.tradepilot.backend.model.ExitRule;
import com.tradepilot.backend.model.Position;
import com.tradepilot.backend.model.SellSignal;
import com.tradepilot.backend.model.StrategyProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class SellRuleEngine {

    private static final int RETURN_SCALE = 6;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * First matching rule in the order stop-loss, take-profit, hold period.
     * Positions without a usable quantity, entry or price never signal.
     */
    public Optional<SellSignal> evaluate(Position position, BigDecimal currentPrice, LocalDate today,
                                         StrategyProfile profile) {
        if (!isPositive(position.quantity()) || !isPositive(position.averagePrice()) || !isPositive(currentPrice)) {
            log.debug("Skipping {}: incomplete position or price data", position.ticker());
            return Optional.empty();
        }
        BigDecimal entry = position.averagePrice();
        BigDecimal returnPct = currentPrice.subtract(entry)
                .multiply(HUNDRED)
                .divide(entry, RETURN_SCALE, RoundingMode.HALF_UP);
        long daysHeld = position.openDate() == null ? 0 : Math.max(0, ChronoUnit.DAYS.between(position.openDate(), today));

        BigDecimal stopLoss = BigDecimal.valueOf(profile.stopLossPct()).negate();
        BigDecimal takeProfit = BigDecimal.valueOf(profile.takeProfitPct());

        // Hard stop first
        if (returnPct.compareTo(stopLoss) <= 0) {
            return Optional.of(signal(position, currentPrice, returnPct, daysHeld, ExitRule.STOP_LOSS,
                    String.format(Locale.ROOT, "Stop-loss: %.1f%% (threshold: %.1f%%)",
                            returnPct.doubleValue(), stopLoss.doubleValue())));
        }
        if (returnPct.compareTo(takeProfit) >= 0) {
            return Optional.of(signal(position, currentPrice, returnPct, daysHeld, ExitRule.TAKE_PROFIT,
                    String.format(Locale.ROOT, "Take-profit: +%.1f%% (threshold: +%.1f%%)",
                            returnPct.doubleValue(), takeProfit.doubleValue())));
        }
        if (daysHeld >= profile.maxHoldDays()) {
            return Optional.of(signal(position, currentPrice, returnPct, daysHeld, ExitRule.HOLD_PERIOD,
                    String.format(Locale.ROOT, "Hold period: %d days (max: %d)", daysHeld, profile.maxHoldDays())));
        }
        return Optional.empty();
    }

    public List<SellSignal> evaluateAll(List<Position> positions, Map<String, BigDecimal> prices,
                                        LocalDate today, StrategyProfile profile) {
        List<SellSignal> signals = new ArrayList<>();
        for (Position position : positions) {
            BigDecimal price = prices.get(position.ticker());
            if (price == null) {
                log.warn("No price for {}, skipping exit checks", position.ticker());
                continue;
            }
            evaluate(position, price, today, profile).ifPresent(signals::add);
        }
        return signals;
    }

    private static SellSignal signal(Position position, BigDecimal currentPrice, BigDecimal returnPct,
                                     long daysHeld, ExitRule rule, String reason) {
        return new SellSignal(position.ticker(), position.accountId(), rule, currentPrice,
                position.averagePrice(), returnPct, daysHeld, position.quantity(), reason);
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
