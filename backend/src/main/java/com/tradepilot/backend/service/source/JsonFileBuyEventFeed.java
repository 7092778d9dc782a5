package com.tradepilot.backend.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.backend.exception.SourceUnavailableException;
import com.tradepilot.backend.model.BuyEvent;
import com.tradepilot.backend.trading.pipeline.BuyEventFeed;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads insider purchases dropped by the filings collector as a JSON array:
 * <pre>
 * [{"ticker": "ACME", "insiderName": "Jane Roe", "title": "CEO",
 *   "deltaOwn": "New", "tradeDate": "2024-05-02", "valueUsd": "$1.2M"}]
 * </pre>
 * {@code deltaOwn} is either {@code "New"} (a newly opened position) or a
 * percentage such as {@code "+5%"} or {@code 5}.
 */
@Slf4j
public class JsonFileBuyEventFeed implements BuyEventFeed {

    static final String SOURCE = "insider";

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileBuyEventFeed(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<BuyEvent> fetchBuyEvents(LocalDate since, LocalDate today) {
        if (!Files.exists(path)) {
            throw new SourceUnavailableException(SOURCE, "Insider feed " + path + " not found");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            throw new SourceUnavailableException(SOURCE, "Insider feed " + path + " unreadable", ex);
        }
        if (root == null || !root.isArray()) {
            throw new SourceUnavailableException(SOURCE, "Insider feed " + path + " is not a JSON array");
        }

        List<BuyEvent> events = new ArrayList<>();
        for (JsonNode node : root) {
            BuyEvent event = toEvent(node);
            if (event == null) {
                continue;
            }
            if (event.tradeDate().isBefore(since) || event.tradeDate().isAfter(today)) {
                continue;
            }
            events.add(event);
        }
        log.debug("Read {} insider buy events from {}", events.size(), path);
        return events;
    }

    private BuyEvent toEvent(JsonNode node) {
        String ticker = node.path("ticker").asText("");
        String insider = node.path("insiderName").asText("");
        if (ticker.isBlank() || insider.isBlank()) {
            return null;
        }
        LocalDate tradeDate;
        try {
            tradeDate = LocalDate.parse(node.path("tradeDate").asText(""));
        } catch (DateTimeParseException ex) {
            log.warn("Skipping insider buy of {} with invalid trade date '{}'", ticker, node.path("tradeDate").asText());
            return null;
        }
        return new BuyEvent(ticker, insider, node.path("title").asText(""),
                parseDeltaOwn(node.path("deltaOwn")), tradeDate, parseValue(node.path("valueUsd")));
    }

    static double parseDeltaOwn(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        String text = node.asText("").trim();
        if (text.equalsIgnoreCase("new")) {
            return BuyEvent.NEW_POSITION_PCT;
        }
        String clean = text.replace("%", "").replace("+", "").replace(",", "").trim();
        if (clean.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(clean);
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }

    /**
     * Accepts plain numbers as well as {@code "$1,234,567"}, {@code "$1.2M"} and {@code "$850K"}.
     */
    static double parseValue(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        String clean = node.asText("").trim().replace("$", "").replace(",", "").replace("+", "")
                .toUpperCase(Locale.ROOT);
        if (clean.isEmpty() || clean.equals("-")) {
            return 0.0;
        }
        try {
            if (clean.endsWith("M")) {
                return Double.parseDouble(clean.substring(0, clean.length() - 1)) * 1_000_000;
            }
            if (clean.endsWith("K")) {
                return Double.parseDouble(clean.substring(0, clean.length() - 1)) * 1_000;
            }
            return Double.parseDouble(clean);
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }
}
