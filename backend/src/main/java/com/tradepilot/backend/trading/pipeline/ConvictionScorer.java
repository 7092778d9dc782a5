package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.model.BuyEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns raw insider buy events into per-ticker conviction scores.
 *
 * <p>Per event: {@code stakeIncreasePct * titleMultiplier * e^(-decayRate * daysSinceTrade)}.
 * Event scores are summed per ticker over the lookback window. A ticker is kept
 * only when it is a cluster buy, or a single C-suite insider raised their stake
 * by at least the configured threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConvictionScorer {

    private static final Pattern TITLE_SEPARATORS = Pattern.compile("[,/&;]|\\bAND\\b");

    private static final Map<String, String> TITLE_ALIASES = Map.ofEntries(
            Map.entry("PRES", "PRESIDENT"),
            Map.entry("COB", "CHAIRMAN"),
            Map.entry("CHAIR", "CHAIRMAN"),
            Map.entry("CHAIRWOMAN", "CHAIRMAN"),
            Map.entry("CHAIRPERSON", "CHAIRMAN"),
            Map.entry("CHAIRMAN OF THE BOARD", "CHAIRMAN"),
            Map.entry("CHIEF EXECUTIVE OFFICER", "CEO"),
            Map.entry("CHIEF FINANCIAL OFFICER", "CFO"),
            Map.entry("CHIEF OPERATING OFFICER", "COO"),
            Map.entry("CHIEF TECHNOLOGY OFFICER", "CTO")
    );

    private final StrategyProperties strategyProperties;

    public double eventScore(BuyEvent event, LocalDate today) {
        return eventScore(event, today, csuiteTitles());
    }

    public boolean isCsuite(String title) {
        return isCsuite(title, csuiteTitles());
    }

    private double eventScore(BuyEvent event, LocalDate today, Set<String> csuite) {
        StrategyProperties.Conviction config = strategyProperties.getConviction();
        double multiplier = isCsuite(event.insiderTitle(), csuite) ? config.getCsuiteMultiplier() : 1.0;
        return event.stakeIncreasePct() * multiplier * Math.exp(-config.getDecayRate() * daysSinceTrade(event, today));
    }

    private static boolean isCsuite(String title, Set<String> csuite) {
        if (title == null || title.isBlank()) {
            return false;
        }
        for (String token : TITLE_SEPARATORS.split(title.toUpperCase(Locale.ROOT))) {
            String normalized = token.trim().replaceAll("\\.", "").replaceAll("\\s+", " ");
            if (normalized.isEmpty()) {
                continue;
            }
            String canonical = TITLE_ALIASES.getOrDefault(normalized, normalized);
            if (csuite.contains(canonical)) {
                return true;
            }
        }
        return false;
    }

    private Set<String> csuiteTitles() {
        return strategyProperties.getConviction().getCsuiteTitles().stream()
                .map(value -> value.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Scores, filters and ranks the given events. Events outside the lookback
     * window and blank tickers are ignored.
     */
    public List<ConvictionScore> score(List<BuyEvent> events, LocalDate today) {
        StrategyProperties.Conviction config = strategyProperties.getConviction();
        Set<String> csuite = csuiteTitles();
        Map<String, List<BuyEvent>> byTicker = new LinkedHashMap<>();
        for (BuyEvent event : events) {
            if (event.ticker().isEmpty() || event.tradeDate() == null) {
                continue;
            }
            if (daysSinceTrade(event, today) > config.getLookbackDays()) {
                continue;
            }
            byTicker.computeIfAbsent(event.ticker(), key -> new ArrayList<>()).add(event);
        }

        List<ConvictionScore> qualified = new ArrayList<>();
        byTicker.forEach((ticker, tickerEvents) -> {
            ConvictionScore aggregate = aggregate(ticker, tickerEvents, today, csuite);
            if (qualifies(aggregate, csuite)) {
                qualified.add(aggregate);
            } else {
                log.debug("Conviction: {} discarded (insiders={}, csuite={})",
                        ticker, aggregate.insiderCount(), aggregate.csuiteBuyer());
            }
        });

        return qualified.stream()
                .sorted(ranking())
                .limit(config.getTopN())
                .toList();
    }

    private ConvictionScore aggregate(String ticker, List<BuyEvent> events, LocalDate today, Set<String> csuiteTitles) {
        double score = 0.0;
        double totalValue = 0.0;
        LocalDate latest = null;
        boolean csuite = false;
        Set<String> insiders = new LinkedHashSet<>();
        for (BuyEvent event : events) {
            score += eventScore(event, today, csuiteTitles);
            totalValue += event.valueUsd();
            insiders.add(event.insiderId());
            csuite |= isCsuite(event.insiderTitle(), csuiteTitles);
            if (latest == null || event.tradeDate().isAfter(latest)) {
                latest = event.tradeDate();
            }
        }
        return new ConvictionScore(ticker, score, insiders.size(), csuite, latest, totalValue, List.copyOf(events));
    }

    private boolean qualifies(ConvictionScore aggregate, Set<String> csuite) {
        StrategyProperties.Conviction config = strategyProperties.getConviction();
        if (aggregate.insiderCount() >= config.getMinInsidersForCluster()) {
            return true;
        }
        if (aggregate.insiderCount() != 1 || !aggregate.csuiteBuyer()) {
            return false;
        }
        double largestStake = aggregate.events().stream()
                .filter(event -> isCsuite(event.insiderTitle(), csuite))
                .mapToDouble(BuyEvent::stakeIncreasePct)
                .max()
                .orElse(0.0);
        return largestStake >= config.getCsuiteStakeThresholdPct();
    }

    // score desc, then most recent trade desc, then ticker asc
    private static Comparator<ConvictionScore> ranking() {
        return Comparator.comparingDouble(ConvictionScore::score).reversed()
                .thenComparing(ConvictionScore::latestTradeDate, Comparator.reverseOrder())
                .thenComparing(ConvictionScore::ticker);
    }

    private static long daysSinceTrade(BuyEvent event, LocalDate today) {
        return Math.max(0, ChronoUnit.DAYS.between(event.tradeDate(), today));
    }
}
