package com.tradepilot.backend.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cooldown entries as {@code {"TICKER": "YYYY-MM-DD"}}. The file is the only
 * durable state of the trading pipeline and can always be rebuilt from empty.
 */
@Slf4j
public class JsonFileCooldownRepository implements CooldownRepository {

    private final JsonFileStore store;

    public JsonFileCooldownRepository(Path path, ObjectMapper objectMapper) {
        this.store = new JsonFileStore(path, objectMapper);
    }

    @Override
    public synchronized Map<String, LocalDate> findAll() {
        Map<String, LocalDate> entries = new TreeMap<>();
        store.read().ifPresent(root -> {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String ticker = field.getKey().trim().toUpperCase(Locale.ROOT);
                try {
                    entries.put(ticker, LocalDate.parse(field.getValue().asText()));
                } catch (DateTimeParseException ex) {
                    log.warn("Skipping cooldown entry {} with invalid date '{}'", ticker, field.getValue().asText());
                }
            }
        });
        return entries;
    }

    @Override
    public Optional<LocalDate> findLastBought(String ticker) {
        return Optional.ofNullable(findAll().get(ticker));
    }

    @Override
    public synchronized void save(String ticker, LocalDate lastBought) {
        saveAll(Map.of(ticker, lastBought));
    }

    @Override
    public synchronized void saveAll(Map<String, LocalDate> values) {
        Map<String, LocalDate> entries = findAll();
        entries.putAll(values);
        Map<String, String> document = new TreeMap<>();
        entries.forEach((ticker, date) -> document.put(ticker, date.toString()));
        store.write(document);
        log.debug("Persisted {} cooldown entries to {}", document.size(), store.path());
    }
}
