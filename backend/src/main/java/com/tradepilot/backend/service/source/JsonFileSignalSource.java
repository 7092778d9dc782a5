package com.tradepilot.backend.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.backend.exception.SourceUnavailableException;
import com.tradepilot.backend.model.SourceHit;
import com.tradepilot.backend.trading.pipeline.SignalSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic ranked ticker list written by a collector (screener, earnings
 * calendar, social mentions). Array order is the source's ranking. Entries are
 * either plain tickers or objects with {@code ticker}, optional {@code score}
 * and any further fields kept as evidence.
 */
@Slf4j
public class JsonFileSignalSource implements SignalSource {

    private final String name;
    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonFileSignalSource(String name, Path path, ObjectMapper objectMapper) {
        this.name = name;
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<SourceHit> fetch(LocalDate today) {
        if (!Files.exists(path)) {
            throw new SourceUnavailableException(name, "Feed " + path + " not found");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException ex) {
            throw new SourceUnavailableException(name, "Feed " + path + " unreadable", ex);
        }
        JsonNode entries = root != null && root.isObject() ? root.path("hits") : root;
        if (entries == null || !entries.isArray()) {
            throw new SourceUnavailableException(name, "Feed " + path + " has no ticker list");
        }

        List<SourceHit> hits = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (entry.isTextual()) {
                hits.add(SourceHit.of(entry.asText(), name, hits.size()));
            } else if (entry.isObject() && !entry.path("ticker").asText("").isBlank()) {
                hits.add(new SourceHit(entry.path("ticker").asText(), name, hits.size(),
                        entry.path("score").asDouble(0.0), evidence(entry)));
            }
        }
        return hits;
    }

    private Map<String, Object> evidence(JsonNode entry) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = entry.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equals("ticker") || field.getKey().equals("score") || field.getValue().isNull()) {
                continue;
            }
            evidence.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
        }
        return evidence;
    }
}
