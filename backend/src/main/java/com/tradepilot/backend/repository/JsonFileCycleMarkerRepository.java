package com.tradepilot.backend.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Last completed cycle as {@code {"lastRun": "YYYY-MM-DD"}}.
 */
@Slf4j
public class JsonFileCycleMarkerRepository implements CycleMarkerRepository {

    private static final String LAST_RUN = "lastRun";

    private final JsonFileStore store;

    public JsonFileCycleMarkerRepository(Path path, ObjectMapper objectMapper) {
        this.store = new JsonFileStore(path, objectMapper);
    }

    @Override
    public Optional<LocalDate> findLastRun() {
        Optional<JsonNode> value = store.read().map(root -> root.get(LAST_RUN));
        if (value.isEmpty() || value.get().isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value.get().asText()));
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring invalid cycle marker '{}' in {}", value.get().asText(), store.path());
            return Optional.empty();
        }
    }

    @Override
    public void saveLastRun(LocalDate date) {
        store.write(Map.of(LAST_RUN, date.toString()));
    }
}
