package com.tradepilot.backend.service.broker;

import com.tradepilot.backend.config.BrokerProperties;
import com.tradepilot.backend.exception.OrderRejectedException;
import com.tradepilot.backend.model.Position;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperBrokerPortTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    private PaperBrokerPort broker(String startingCash) {
        BrokerProperties properties = new BrokerProperties();
        properties.getPaper().setStartingCash(new BigDecimal(startingCash));
        properties.getPaper().getPrices().put("acme", new BigDecimal("40"));
        return new PaperBrokerPort(properties, Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void onlyQuotedTickersAreTradable() {
        PaperBrokerPort broker = broker("100");

        assertThat(broker.resolveInstrument("Acme")).contains("ACME");
        assertThat(broker.resolveInstrument("NOPE")).isEmpty();
    }

    @Test
    void buysFractionalQuantityAndTracksCash() {
        PaperBrokerPort broker = broker("100");

        BrokerPort.OrderFill fill = broker.placeBuyOrder("practice", "ACME", new BigDecimal("50"), new BigDecimal("40"));

        assertThat(fill.filledQuantity()).isEqualByComparingTo("1.25");
        assertThat(fill.filledValue()).isEqualByComparingTo("50");
        assertThat(broker.availableCash("practice")).isEqualByComparingTo("50");
        assertThat(broker.availableCash("live")).isEqualByComparingTo("100");
        assertThat(broker.openPositions("practice")).singleElement()
                .extracting(Position::openDate).isEqualTo(TODAY);
    }

    @Test
    void averagesRepeatedBuysAndSellsOut() {
        PaperBrokerPort broker = broker("1000");
        broker.placeBuyOrder("practice", "ACME", new BigDecimal("40"), new BigDecimal("40"));
        broker.setPrice("ACME", new BigDecimal("60"));
        broker.placeBuyOrder("practice", "ACME", new BigDecimal("60"), new BigDecimal("60"));

        Position position = broker.openPositions("practice").get(0);
        assertThat(position.quantity()).isEqualByComparingTo("2");
        assertThat(position.averagePrice()).isEqualByComparingTo("50");

        BrokerPort.OrderFill sale = broker.placeSellOrder("practice", "ACME", new BigDecimal("2"));

        assertThat(sale.filledValue()).isEqualByComparingTo("120");
        assertThat(broker.openPositions("practice")).isEmpty();
        assertThat(broker.availableCash("practice")).isEqualByComparingTo("1020");
    }

    @Test
    void rejectsOrdersAboveCashOrPosition() {
        PaperBrokerPort broker = broker("10");

        assertThatThrownBy(() -> broker.placeBuyOrder("practice", "ACME", new BigDecimal("50"), new BigDecimal("40")))
                .isInstanceOf(OrderRejectedException.class)
                .hasMessageContaining("insufficient funds");
        assertThatThrownBy(() -> broker.placeSellOrder("practice", "ACME", BigDecimal.ONE))
                .isInstanceOf(OrderRejectedException.class);
    }

    @Test
    void sellsSeededPosition() {
        PaperBrokerPort broker = broker("0");
        broker.addPosition(new Position("acme", new BigDecimal("2"), new BigDecimal("30"), TODAY.minusDays(6), "live"));

        BrokerPort.OrderFill fill = broker.placeSellOrder("live", "ACME", new BigDecimal("2"));

        assertThat(fill.filledValue()).isEqualByComparingTo("80");
        assertThat(broker.availableCash("live")).isEqualByComparingTo("80");
        assertThat(broker.openPositions("live")).isEmpty();
    }
}
