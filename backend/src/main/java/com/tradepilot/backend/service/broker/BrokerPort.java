package com.tradepilot.backend.service.broker;

import com.tradepilot.backend.exception.OrderRejectedException;
import com.tradepilot.backend.model.Position;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Account and order access on the execution venue. Implementations signal
 * venue-side refusals with {@link OrderRejectedException}; any other runtime
 * exception is treated as a transport failure by callers.
 */
public interface BrokerPort {

    /**
     * Venue instrument id for a ticker, or empty when the venue does not trade it.
     */
    Optional<String> resolveInstrument(String ticker);

    Optional<BigDecimal> currentPrice(String instrument);

    BigDecimal availableCash(String accountId);

    OrderFill placeBuyOrder(String accountId, String instrument, BigDecimal amount, BigDecimal price);

    OrderFill placeSellOrder(String accountId, String instrument, BigDecimal quantity);

    List<Position> openPositions(String accountId);

    /**
     * @param filledValue cash actually committed; may differ from the requested amount
     */
    record OrderFill(String orderId, String instrument, BigDecimal filledQuantity, BigDecimal filledValue) {}
}
