package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.model.Pick;
import com.tradepilot.backend.model.Position;

import java.math.BigDecimal;
import java.util.List;

/**
 * Turns merged candidates into a rank-ordered pick list for one budget.
 */
public interface DecisionStage {

    List<Pick> decide(List<Candidate> candidates, List<Position> portfolio, BigDecimal budget);
}
