package com.tradepilot.backend.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tradepilot.backend.exception.PersistenceCorruptException;
import com.tradepilot.backend.exception.TradingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Small human-readable JSON document on disk. Reads never fail: a missing,
 * blank or unparsable file reads as empty. Writes replace the file atomically
 * where the file system allows it.
 */
@Slf4j
class JsonFileStore {

    private final Path path;
    private final ObjectMapper objectMapper;

    JsonFileStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    Path path() {
        return path;
    }

    Optional<JsonNode> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(parse(content));
        } catch (IOException | PersistenceCorruptException ex) {
            log.warn("Ignoring unreadable store {}: {}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    synchronized void write(Object document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, objectMapper.writeValueAsString(document), StandardCharsets.UTF_8);
                move(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException ex) {
            throw new TradingException("Failed to write " + path, ex);
        }
    }

    private JsonNode parse(String content) {
        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || !node.isObject()) {
                throw new PersistenceCorruptException("Expected a JSON object in " + path, null);
            }
            return node;
        } catch (JsonProcessingException ex) {
            throw new PersistenceCorruptException("Malformed JSON in " + path, ex);
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move unsupported for {}, falling back to replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
