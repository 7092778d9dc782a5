package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.exception.OrderRejectedException;
import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.model.Pick;
import com.tradepilot.backend.model.Position;
import com.tradepilot.backend.repository.InMemoryCooldownRepository;
import com.tradepilot.backend.service.CooldownTracker;
import com.tradepilot.backend.service.broker.BrokerPort;
import com.tradepilot.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TradeExecutorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    private StrategyProperties properties;
    private CooldownTracker cooldownTracker;

    @BeforeEach
    void setUp() {
        properties = new StrategyProperties();
        cooldownTracker = new CooldownTracker(new InMemoryCooldownRepository(), properties,
                Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void fallsBackToNextPickWhenTopPickIsNotTradable() {
        FakeBroker broker = new FakeBroker(MoneyUtils.bd(5_000));
        broker.price("B", 10);
        broker.price("C", 20);
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(request(1_000,
                Pick.ofPercent("A", 60, 0), Pick.ofPercent("B", 50, 1), Pick.ofPercent("C", 40, 2)));

        assertThat(summary.failed()).extracting(TradeResult::ticker).containsExactly("A");
        assertThat(summary.failed().get(0).reason()).isEqualTo(FailureReason.NOT_TRADABLE);
        assertThat(summary.failed().get(0).message()).isEqualTo("not tradable");
        assertThat(summary.bought()).extracting(TradeResult::ticker).containsExactly("B", "C");
        assertThat(summary.bought().get(0).requestedAmount()).isEqualByComparingTo("500");
        assertThat(summary.bought().get(1).requestedAmount()).isEqualByComparingTo("400");
        assertThat(summary.totalSpent()).isEqualByComparingTo("900");
        assertThat(broker.orderedTickers).containsExactly("B", "C");
        assertThat(summary.stopReason()).isEqualTo(ExecutionSummary.StopReason.PICKS_EXHAUSTED);
    }

    @Test
    void attemptsNothingWithoutBudget() {
        BrokerPort broker = mock(BrokerPort.class);
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary zero = executor.execute(request(0, Pick.ofPercent("ACME", 100, 0)));
        ExecutionSummary belowUnit = executor.execute(request(0.5, Pick.ofPercent("ACME", 100, 0)));

        for (ExecutionSummary summary : List.of(zero, belowUnit)) {
            assertThat(summary.bought()).isEmpty();
            assertThat(summary.failed()).isEmpty();
            assertThat(summary.totalSpent()).isEqualByComparingTo(BigDecimal.ZERO);
        }
        verifyNoInteractions(broker);
    }

    @Test
    void neverSpendsMoreThanBudgetUnderRandomFailures() {
        Random random = new Random(42);
        for (int run = 0; run < 200; run++) {
            double budget = 1 + random.nextInt(2_000);
            FakeBroker broker = new FakeBroker(MoneyUtils.bd(random.nextBoolean() ? 10_000 : random.nextInt(3_000)));
            broker.random = random;
            List<Pick> picks = new ArrayList<>();
            int count = 1 + random.nextInt(8);
            for (int i = 0; i < count; i++) {
                String ticker = "T" + random.nextInt(6);
                if (random.nextInt(5) > 0) {
                    broker.price(ticker, 1 + random.nextInt(300));
                }
                picks.add(random.nextBoolean()
                        ? Pick.ofPercent(ticker, random.nextInt(120), random.nextInt(10))
                        : Pick.ofAmount(ticker, MoneyUtils.bd(random.nextInt(1_500)), random.nextInt(10)));
            }
            TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

            ExecutionSummary summary = executor.execute(request(budget, picks.toArray(Pick[]::new)));

            BigDecimal spent = summary.bought().stream().map(TradeResult::filledAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(spent).isLessThanOrEqualTo(MoneyUtils.bd(budget));
            assertThat(summary.totalSpent()).isEqualByComparingTo(spent);

            Set<String> bought = new HashSet<>();
            summary.bought().forEach(result -> bought.add(result.ticker()));
            Set<String> failed = new HashSet<>();
            summary.failed().forEach(result -> failed.add(result.ticker()));
            assertThat(Collections.disjoint(bought, failed)).isTrue();
            assertThat(bought).hasSize(summary.bought().size());
            assertThat(new HashSet<>(broker.orderedTickers)).hasSize(broker.orderedTickers.size());
        }
    }

    @Test
    void skipsDuplicateAndBlankTickers() {
        FakeBroker broker = new FakeBroker(MoneyUtils.bd(1_000));
        broker.price("ACME", 10);
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(request(100,
                Pick.ofPercent("ACME", 30, 0), Pick.ofPercent("acme", 30, 1), Pick.ofPercent(" ", 30, 2)));

        assertThat(broker.orderedTickers).containsExactly("ACME");
        assertThat(summary.skipped()).extracting(TradeResult::reason)
                .containsExactly(FailureReason.DUPLICATE, FailureReason.INVALID_TICKER);
    }

    @Test
    void stopsAtAttemptCapCountingFailures() {
        FakeBroker broker = new FakeBroker(MoneyUtils.bd(1_000));
        broker.price("BBB", 10);
        broker.price("CCC", 10);
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(ExecutionRequest.builder()
                .accountId("practice")
                .budget(MoneyUtils.bd(100))
                .minTradeUnit(BigDecimal.ONE)
                .maxAttempts(2)
                .runDate(TODAY)
                .picks(List.of(Pick.ofPercent("AAA", 10, 0), Pick.ofPercent("BBB", 10, 1), Pick.ofPercent("CCC", 10, 2)))
                .build());

        assertThat(summary.failed()).extracting(TradeResult::ticker).containsExactly("AAA");
        assertThat(summary.bought()).extracting(TradeResult::ticker).containsExactly("BBB");
        assertThat(summary.stopReason()).isEqualTo(ExecutionSummary.StopReason.ATTEMPT_CAP_REACHED);
    }

    @Test
    void decrementsBudgetByActualFill() {
        FakeBroker broker = new FakeBroker(MoneyUtils.bd(1_000));
        broker.price("AAA", 10);
        broker.price("BBB", 10);
        broker.fillRatio.put("AAA", new BigDecimal("0.5"));
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(request(100,
                Pick.ofAmount("AAA", MoneyUtils.bd(80), 0), Pick.ofAmount("BBB", MoneyUtils.bd(100), 1),
                Pick.ofAmount("CCC", MoneyUtils.bd(10), 2)));

        assertThat(summary.bought().get(0).filledAmount()).isEqualByComparingTo("40");
        assertThat(summary.bought().get(1).requestedAmount()).isEqualByComparingTo("60");
        assertThat(summary.totalSpent()).isEqualByComparingTo("100");
        assertThat(summary.stopReason()).isEqualTo(ExecutionSummary.StopReason.BUDGET_EXHAUSTED);
    }

    @Test
    void recordsCooldownOnlyForSuccessfulOrders() {
        BrokerPort broker = mock(BrokerPort.class);
        when(broker.availableCash(anyString())).thenReturn(MoneyUtils.bd(1_000));
        when(broker.resolveInstrument(anyString())).thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));
        when(broker.currentPrice(anyString())).thenReturn(Optional.of(MoneyUtils.bd(10)));
        when(broker.placeBuyOrder(anyString(), eq("GOOD"), any(), any()))
                .thenReturn(new BrokerPort.OrderFill("o-1", "GOOD", BigDecimal.ONE, MoneyUtils.bd(10)));
        when(broker.placeBuyOrder(anyString(), eq("REJECT"), any(), any()))
                .thenThrow(new OrderRejectedException("REJECT", "market closed"));
        when(broker.placeBuyOrder(anyString(), eq("ERROR"), any(), any()))
                .thenThrow(new IllegalStateException("connection reset"));
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(request(30,
                Pick.ofPercent("REJECT", 30, 0), Pick.ofPercent("ERROR", 30, 1), Pick.ofPercent("GOOD", 30, 2)));

        assertThat(summary.failed()).extracting(TradeResult::reason)
                .containsExactly(FailureReason.ORDER_REJECTED, FailureReason.BROKER_ERROR);
        assertThat(summary.failed().get(0).message()).isEqualTo("market closed");
        assertThat(cooldownTracker.blockedTickers(TODAY)).containsExactly("GOOD");
        verify(broker, times(1)).placeBuyOrder(anyString(), eq("REJECT"), any(), any());
    }

    @Test
    void failsTickersWithoutPriceOrUnresolvedTradability() {
        BrokerPort broker = mock(BrokerPort.class);
        when(broker.availableCash(anyString())).thenReturn(MoneyUtils.bd(1_000));
        when(broker.resolveInstrument("NOPX")).thenReturn(Optional.of("NOPX"));
        when(broker.resolveInstrument("DOWN")).thenThrow(new IllegalStateException("instrument service down"));
        when(broker.currentPrice("NOPX")).thenReturn(Optional.of(BigDecimal.ZERO));
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(request(100, Pick.ofPercent("NOPX", 50, 0), Pick.ofPercent("DOWN", 50, 1)));

        assertThat(summary.failed()).extracting(TradeResult::reason)
                .containsExactly(FailureReason.NO_PRICE, FailureReason.TRADABILITY_UNRESOLVED);
        verify(broker, never()).placeBuyOrder(anyString(), anyString(), any(), any());
    }

    @Test
    void capsBudgetAtAvailableCashAndFallsBackWhenCashUnknown() {
        FakeBroker poor = new FakeBroker(MoneyUtils.bd(50));
        poor.price("ACME", 10);
        ExecutionSummary capped = new TradeExecutor(poor, cooldownTracker).execute(request(100, Pick.ofPercent("ACME", 100, 0)));

        assertThat(capped.effectiveBudget()).isEqualByComparingTo("50");
        assertThat(capped.totalSpent()).isEqualByComparingTo("50");

        BrokerPort unknownCash = mock(BrokerPort.class);
        when(unknownCash.availableCash(anyString())).thenThrow(new IllegalStateException("timeout"));
        when(unknownCash.resolveInstrument("ACME")).thenReturn(Optional.empty());
        ExecutionSummary fallback = new TradeExecutor(unknownCash, cooldownTracker).execute(request(100, Pick.ofPercent("ACME", 100, 0)));

        assertThat(fallback.availableCash()).isNull();
        assertThat(fallback.effectiveBudget()).isEqualByComparingTo("100");
    }

    @Test
    void keepsRequestedAllocationsWhenTheyAddUpToMoreThanTheBudget() {
        FakeBroker broker = new FakeBroker(MoneyUtils.bd(1_000));
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            String ticker = "T" + (char) ('A' + i) + "X";
            broker.price(ticker, 1);
            candidates.add(new Candidate(ticker, 1.0, List.of(), null));
        }
        List<Pick> picks = new TopCandidateDecisionStage(3).decide(candidates, List.of(), MoneyUtils.bd(10));
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(ExecutionRequest.builder()
                .accountId("live")
                .budget(MoneyUtils.bd(10))
                .minTradeUnit(BigDecimal.ONE)
                .maxAttempts(3)
                .runDate(TODAY)
                .picks(picks)
                .build());

        assertThat(summary.bought()).hasSize(3);
        assertThat(summary.bought()).extracting(TradeResult::requestedAmount)
                .allSatisfy(amount -> assertThat(amount).isEqualByComparingTo("3.3333"));
        assertThat(summary.skipped()).isEmpty();
        assertThat(summary.totalSpent()).isEqualByComparingTo("9.9999");
    }

    @Test
    void flagsVenueOverfillAboveBudget() {
        FakeBroker broker = new FakeBroker(MoneyUtils.bd(1_000));
        broker.price("AAA", 10);
        broker.price("BBB", 10);
        broker.fillRatio.put("AAA", new BigDecimal("1.5"));
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(request(100,
                Pick.ofPercent("AAA", 100, 0), Pick.ofPercent("BBB", 50, 1)));

        assertThat(summary.bought().get(0).requestedAmount()).isEqualByComparingTo("100");
        assertThat(summary.totalSpent()).isEqualByComparingTo("150");
        assertThat(summary.overfilled()).isTrue();
        assertThat(broker.orderedTickers).containsExactly("AAA");
        assertThat(summary.stopReason()).isEqualTo(ExecutionSummary.StopReason.BUDGET_EXHAUSTED);
    }

    @Test
    void stopsWhenAbortedAndReportsEveryResult() {
        FakeBroker broker = new FakeBroker(MoneyUtils.bd(1_000));
        broker.price("AAA", 10);
        broker.price("BBB", 10);
        AtomicBoolean abort = new AtomicBoolean(false);
        List<TradeResult> seen = new ArrayList<>();
        TradeExecutor executor = new TradeExecutor(broker, cooldownTracker);

        ExecutionSummary summary = executor.execute(ExecutionRequest.builder()
                .accountId("practice")
                .budget(MoneyUtils.bd(100))
                .minTradeUnit(BigDecimal.ONE)
                .runDate(TODAY)
                .picks(List.of(Pick.ofPercent("AAA", 50, 0), Pick.ofPercent("BBB", 50, 1)))
                .listener(result -> {
                    seen.add(result);
                    abort.set(true);
                })
                .abortSignal(abort::get)
                .build());

        assertThat(seen).extracting(TradeResult::ticker).containsExactly("AAA");
        assertThat(summary.bought()).hasSize(1);
        assertThat(summary.stopReason()).isEqualTo(ExecutionSummary.StopReason.INTERRUPTED);
        assertThat(broker.orderedTickers).containsExactly("AAA");
    }

    private static ExecutionRequest request(double budget, Pick... picks) {
        return ExecutionRequest.builder()
                .accountId("practice")
                .budget(MoneyUtils.bd(budget))
                .minTradeUnit(BigDecimal.ONE)
                .runDate(TODAY)
                .picks(List.of(picks))
                .build();
    }

    private static class FakeBroker implements BrokerPort {
        private final Map<String, BigDecimal> prices = new HashMap<>();
        private final Map<String, BigDecimal> fillRatio = new HashMap<>();
        private final List<String> orderedTickers = new ArrayList<>();
        private final BigDecimal cash;
        private Random random;

        FakeBroker(BigDecimal cash) {
            this.cash = cash;
        }

        void price(String ticker, double price) {
            prices.put(ticker, MoneyUtils.bd(price));
        }

        @Override
        public Optional<String> resolveInstrument(String ticker) {
            if (random != null && random.nextInt(10) == 0) {
                throw new IllegalStateException("lookup failed");
            }
            return prices.containsKey(ticker) ? Optional.of(ticker) : Optional.empty();
        }

        @Override
        public Optional<BigDecimal> currentPrice(String instrument) {
            return Optional.ofNullable(prices.get(instrument));
        }

        @Override
        public BigDecimal availableCash(String accountId) {
            return cash;
        }

        @Override
        public OrderFill placeBuyOrder(String accountId, String instrument, BigDecimal amount, BigDecimal price) {
            orderedTickers.add(instrument);
            if (random != null) {
                int outcome = random.nextInt(4);
                if (outcome == 0) {
                    throw new OrderRejectedException(instrument, "rejected");
                }
                if (outcome == 1) {
                    throw new IllegalStateException("venue error");
                }
                if (outcome == 2) {
                    BigDecimal partial = amount.multiply(BigDecimal.valueOf(random.nextInt(100)))
                            .divide(BigDecimal.valueOf(100), MoneyUtils.SCALE, RoundingMode.DOWN);
                    return new OrderFill("o-" + orderedTickers.size(), instrument, BigDecimal.ONE, partial);
                }
            }
            BigDecimal filled = amount.multiply(fillRatio.getOrDefault(instrument, BigDecimal.ONE));
            return new OrderFill("o-" + orderedTickers.size(), instrument,
                    filled.divide(price, 6, RoundingMode.DOWN), filled);
        }

        @Override
        public OrderFill placeSellOrder(String accountId, String instrument, BigDecimal quantity) {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<Position> openPositions(String accountId) {
            return List.of();
        }
    }
}
