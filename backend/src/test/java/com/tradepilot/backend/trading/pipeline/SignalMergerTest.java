package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.exception.SourceUnavailableException;
import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.model.SourceFeed;
import com.tradepilot.backend.model.SourceHit;
import com.tradepilot.backend.repository.InMemoryCooldownRepository;
import com.tradepilot.backend.service.CooldownTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalMergerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);

    private StrategyProperties properties;
    private CooldownTracker cooldownTracker;
    private SignalMerger merger;

    @BeforeEach
    void setUp() {
        properties = new StrategyProperties();
        cooldownTracker = new CooldownTracker(new InMemoryCooldownRepository(), properties,
                Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
        CandidateEnricher enricher = mock(CandidateEnricher.class);
        when(enricher.enrich(anyList())).thenAnswer(invocation -> invocation.getArgument(0));
        merger = new SignalMerger(properties, cooldownTracker, enricher);
    }

    @Test
    void admitsMultiSourceTickerFirstThenFillsByPriority() {
        List<SourceFeed> feeds = List.of(
                feed("screener", "A", "B", "C"),
                feed("insider", "B", "D"));

        List<Candidate> candidates = merger.select(feeds);

        assertThat(candidates).extracting(Candidate::ticker).containsExactly("B", "D", "A", "C");
        assertThat(candidates.get(0).isMultiSource()).isTrue();
        assertThat(candidates.get(0).sourceNames()).containsExactly("insider", "screener");
    }

    @Test
    void stopsAtCandidateLimit() {
        properties.getMerge().setCandidateLimit(3);

        List<Candidate> candidates = merger.select(List.of(
                feed("screener", "A", "B", "C"),
                feed("insider", "B", "D")));

        assertThat(candidates).extracting(Candidate::ticker).containsExactly("B", "D", "A");
    }

    @Test
    void ordersMultiSourceTickersBySourceCountThenScore() {
        List<SourceFeed> feeds = List.of(
                new SourceFeed("insider", List.of(hit("TWO", "insider", 0, 1.0), hit("THREE", "insider", 1, 1.0),
                        hit("RICH", "insider", 2, 50.0))),
                new SourceFeed("screener", List.of(hit("TWO", "screener", 0, 1.0), hit("THREE", "screener", 1, 1.0),
                        hit("RICH", "screener", 2, 50.0))),
                new SourceFeed("earnings", List.of(hit("THREE", "earnings", 0, 0.0))));

        assertThat(merger.select(feeds)).extracting(Candidate::ticker).containsExactly("THREE", "RICH", "TWO");
    }

    @Test
    void undeclaredSourcesFillAfterDeclaredOnes() {
        List<SourceFeed> feeds = List.of(
                feed("zeta", "ZZZ"),
                feed("alpha", "AAA"),
                feed("social", "SOC"));

        assertThat(merger.select(feeds)).extracting(Candidate::ticker).containsExactly("SOC", "AAA", "ZZZ");
    }

    @Test
    void capsSlotsPerSource() {
        properties.getMerge().setMaxSlotsPerSource(Map.of("social", 1));

        List<Candidate> candidates = merger.select(List.of(
                feed("social", "ONE", "TWO", "THREE"),
                feed("earnings", "EARN")));

        assertThat(candidates).extracting(Candidate::ticker).containsExactly("EARN", "ONE");
    }

    @Test
    void filtersNoiseIndicesAndShortSymbolsFromNoisySources() {
        List<Candidate> candidates = merger.select(List.of(
                feed("social", "DD", "AI", "YOLO", "PLTR"),
                feed("screener", "SPY", "F", "nvda")));

        assertThat(candidates).extracting(Candidate::ticker).containsExactly("F", "NVDA", "PLTR");
    }

    @Test
    void sumsScoresOfContributingHits() {
        List<Candidate> candidates = merger.select(List.of(
                new SourceFeed("insider", List.of(hit("ACME", "insider", 0, 12.5))),
                new SourceFeed("screener", List.of(hit("ACME", "screener", 0, 2.5)))));

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).score()).isEqualTo(15.0);
        assertThat(candidates.get(0).sources()).extracting(SourceHit::source).containsExactly("insider", "screener");
    }

    @Test
    void removesTickersInCooldownEvenIfBelowTarget() {
        cooldownTracker.record("B", TODAY.minusDays(1));
        cooldownTracker.record("C", TODAY.minusDays(3));

        MergeResult result = merger.merge(List.of(
                new FixedSource("screener", "A", "B", "C"),
                new FixedSource("insider", "B", "D")), TODAY);

        assertThat(result.candidates()).extracting(Candidate::ticker).containsExactly("D", "A", "C");
        assertThat(result.blockedTickers()).containsExactly("B");
    }

    @Test
    void excludesFailingSourcesAndMergesTheRest() {
        SignalSource unavailable = new FixedSource("earnings") {
            @Override
            public List<SourceHit> fetch(LocalDate today) {
                throw new SourceUnavailableException("earnings", "calendar down");
            }
        };
        SignalSource broken = new FixedSource("social") {
            @Override
            public List<SourceHit> fetch(LocalDate today) {
                throw new IllegalStateException("boom");
            }
        };

        MergeResult result = merger.merge(List.of(unavailable, new FixedSource("screener", "ACME"), broken), TODAY);

        assertThat(result.candidates()).extracting(Candidate::ticker).containsExactly("ACME");
        assertThat(result.unavailableSources()).containsExactly("earnings", "social");
    }

    private static SourceFeed feed(String source, String... tickers) {
        List<SourceHit> hits = new ArrayList<>();
        for (int i = 0; i < tickers.length; i++) {
            hits.add(SourceHit.of(tickers[i], source, i));
        }
        return new SourceFeed(source, hits);
    }

    private static SourceHit hit(String ticker, String source, int rank, double score) {
        return new SourceHit(ticker, source, rank, score, Map.of());
    }

    private static class FixedSource implements SignalSource {
        private final String name;
        private final List<SourceHit> hits;

        FixedSource(String name, String... tickers) {
            this.name = name;
            this.hits = feed(name, tickers).hits();
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public List<SourceHit> fetch(LocalDate today) {
            return hits;
        }
    }
}
