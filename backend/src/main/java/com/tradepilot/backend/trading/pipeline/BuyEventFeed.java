package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.BuyEvent;

import java.time.LocalDate;
import java.util.List;

public interface BuyEventFeed {

    List<BuyEvent> fetchBuyEvents(LocalDate since, LocalDate today);
}
