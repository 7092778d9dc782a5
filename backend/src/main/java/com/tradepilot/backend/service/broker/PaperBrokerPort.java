package com.tradepilot.backend.service.broker;

import com.tradepilot.backend.config.BrokerProperties;
import com.tradepilot.backend.exception.OrderRejectedException;
import com.tradepilot.backend.model.Position;
import com.tradepilot.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory practice venue. Orders fill immediately at the quoted price with
 * fractional quantities; instrument ids are the upper-cased tickers.
 */
@Slf4j
public class PaperBrokerPort implements BrokerPort {

    private static final int QUANTITY_SCALE = 6;

    private final Map<String, BigDecimal> prices = new HashMap<>();
    private final Map<String, BigDecimal> cashByAccount = new HashMap<>();
    private final Map<String, Map<String, Position>> positionsByAccount = new HashMap<>();
    private final BigDecimal startingCash;
    private final Clock clock;

    public PaperBrokerPort(BrokerProperties brokerProperties, Clock clock) {
        this.startingCash = MoneyUtils.scale(brokerProperties.getPaper().getStartingCash());
        this.clock = clock;
        brokerProperties.getPaper().getPrices().forEach(this::setPrice);
    }

    public synchronized void setPrice(String ticker, BigDecimal price) {
        prices.put(ticker.trim().toUpperCase(Locale.ROOT), price);
    }

    @Override
    public synchronized Optional<String> resolveInstrument(String ticker) {
        String instrument = ticker.trim().toUpperCase(Locale.ROOT);
        return prices.containsKey(instrument) ? Optional.of(instrument) : Optional.empty();
    }

    @Override
    public synchronized Optional<BigDecimal> currentPrice(String instrument) {
        return Optional.ofNullable(prices.get(instrument));
    }

    @Override
    public synchronized BigDecimal availableCash(String accountId) {
        return cashByAccount.getOrDefault(accountId, startingCash);
    }

    @Override
    public synchronized OrderFill placeBuyOrder(String accountId, String instrument, BigDecimal amount, BigDecimal price) {
        BigDecimal cash = availableCash(accountId);
        if (cash.compareTo(amount) < 0) {
            throw new OrderRejectedException(instrument, "insufficient funds: " + cash + " available, " + amount + " requested");
        }
        BigDecimal quote = currentPrice(instrument)
                .orElseThrow(() -> new OrderRejectedException(instrument, "instrument not tradable"));
        BigDecimal quantity = amount.divide(quote, QUANTITY_SCALE, RoundingMode.DOWN);
        if (quantity.signum() <= 0) {
            throw new OrderRejectedException(instrument, "amount too small for one unit fraction");
        }
        BigDecimal filledValue = MoneyUtils.scale(quantity.multiply(quote));
        cashByAccount.put(accountId, MoneyUtils.subtract(cash, filledValue));

        Map<String, Position> positions = positionsByAccount.computeIfAbsent(accountId, key -> new LinkedHashMap<>());
        Position existing = positions.get(instrument);
        if (existing == null) {
            positions.put(instrument, new Position(instrument, quantity, quote, LocalDate.now(clock), accountId));
        } else {
            BigDecimal totalQuantity = existing.quantity().add(quantity);
            BigDecimal averagePrice = existing.quantity().multiply(existing.averagePrice())
                    .add(quantity.multiply(quote))
                    .divide(totalQuantity, MoneyUtils.SCALE, RoundingMode.HALF_UP);
            positions.put(instrument, new Position(instrument, totalQuantity, averagePrice, existing.openDate(), accountId));
        }
        log.info("Paper buy {} {} @ {} on {}", quantity, instrument, quote, accountId);
        return new OrderFill(UUID.randomUUID().toString(), instrument, quantity, filledValue);
    }

    @Override
    public synchronized OrderFill placeSellOrder(String accountId, String instrument, BigDecimal quantity) {
        Map<String, Position> positions = positionsByAccount.getOrDefault(accountId, Map.of());
        Position position = positions.get(instrument);
        if (position == null || position.quantity().compareTo(quantity) < 0) {
            throw new OrderRejectedException(instrument, "no position large enough to sell " + quantity);
        }
        BigDecimal quote = currentPrice(instrument)
                .orElseThrow(() -> new OrderRejectedException(instrument, "no price"));
        BigDecimal proceeds = MoneyUtils.scale(quantity.multiply(quote));
        cashByAccount.put(accountId, MoneyUtils.add(availableCash(accountId), proceeds));
        BigDecimal rest = position.quantity().subtract(quantity);
        if (rest.signum() == 0) {
            positions.remove(instrument);
        } else {
            positions.put(instrument, new Position(instrument, rest, position.averagePrice(), position.openDate(), accountId));
        }
        log.info("Paper sell {} {} @ {} on {}", quantity, instrument, quote, accountId);
        return new OrderFill(UUID.randomUUID().toString(), instrument, quantity, proceeds);
    }

    @Override
    public synchronized List<Position> openPositions(String accountId) {
        return new ArrayList<>(positionsByAccount.getOrDefault(accountId, Map.of()).values());
    }

    /**
     * Seeds a position, e.g. one opened before the application started.
     */
    public synchronized void addPosition(Position position) {
        positionsByAccount.computeIfAbsent(position.accountId(), key -> new LinkedHashMap<>())
                .put(position.ticker().toUpperCase(Locale.ROOT), position);
    }
}
