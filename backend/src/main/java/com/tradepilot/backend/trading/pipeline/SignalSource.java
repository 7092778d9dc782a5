package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.exception.SourceUnavailableException;
import com.tradepilot.backend.model.SourceHit;

import java.time.LocalDate;
import java.util.List;

public interface SignalSource {

    /**
     * Source tag, matched against {@code strategy.merge.source-priority}.
     */
    String name();

    /**
     * Hits in the source's own ranking order, best first.
     *
     * @throws SourceUnavailableException when the source cannot deliver this cycle
     */
    List<SourceHit> fetch(LocalDate today);
}
