package com.tradepilot.backend.service.source;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.model.SourceHit;
import com.tradepilot.backend.trading.pipeline.BuyEventFeed;
import com.tradepilot.backend.trading.pipeline.ConvictionScore;
import com.tradepilot.backend.trading.pipeline.ConvictionScorer;
import com.tradepilot.backend.trading.pipeline.SignalSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Insider buying as a signal source: only tickers that pass the conviction
 * filter are surfaced, ranked by conviction score.
 */
@Slf4j
@RequiredArgsConstructor
public class InsiderConvictionSource implements SignalSource {

    private final BuyEventFeed buyEventFeed;
    private final ConvictionScorer convictionScorer;
    private final StrategyProperties strategyProperties;

    @Override
    public String name() {
        return JsonFileBuyEventFeed.SOURCE;
    }

    @Override
    public List<SourceHit> fetch(LocalDate today) {
        LocalDate since = today.minusDays(strategyProperties.getConviction().getLookbackDays());
        List<ConvictionScore> scores = convictionScorer.score(buyEventFeed.fetchBuyEvents(since, today), today);
        List<SourceHit> hits = new ArrayList<>(scores.size());
        for (int rank = 0; rank < scores.size(); rank++) {
            ConvictionScore score = scores.get(rank);
            hits.add(new SourceHit(score.ticker(), name(), rank, score.score(), evidence(score)));
        }
        log.info("Insider conviction: {} qualifying tickers", hits.size());
        return hits;
    }

    private static Map<String, Object> evidence(ConvictionScore score) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("insiderCount", score.insiderCount());
        evidence.put("csuiteBuyer", score.csuiteBuyer());
        evidence.put("clusterBuy", score.isCluster());
        evidence.put("latestTradeDate", score.latestTradeDate().toString());
        evidence.put("totalValueUsd", score.totalValueUsd());
        return evidence;
    }
}
