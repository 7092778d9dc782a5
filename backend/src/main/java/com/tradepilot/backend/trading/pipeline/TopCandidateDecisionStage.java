package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.model.Pick;
import com.tradepilot.backend.model.Position;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fallback decision stage used when no model-backed stage is wired. Keeps the
 * merge ranking, drops tickers already held and gives every pick an equal
 * share of the budget sized for {@code targetPositions} buys. Later picks act
 * as fallbacks for ones that cannot be bought.
 */
@Slf4j
public class TopCandidateDecisionStage implements DecisionStage {

    private final int targetPositions;

    public TopCandidateDecisionStage(int targetPositions) {
        this.targetPositions = Math.max(1, targetPositions);
    }

    @Override
    public List<Pick> decide(List<Candidate> candidates, List<Position> portfolio, BigDecimal budget) {
        Set<String> held = portfolio.stream()
                .map(position -> position.ticker().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        double allocation = 100.0 / targetPositions;
        List<Pick> picks = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (held.contains(candidate.ticker())) {
                log.debug("Skipping {}: already held", candidate.ticker());
                continue;
            }
            picks.add(Pick.ofPercent(candidate.ticker(), allocation, picks.size()));
        }
        return picks;
    }
}
