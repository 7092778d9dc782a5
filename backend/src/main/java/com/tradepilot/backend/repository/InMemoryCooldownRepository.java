package com.tradepilot.backend.repository;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCooldownRepository implements CooldownRepository {

    private final Map<String, LocalDate> entries = new ConcurrentHashMap<>();

    @Override
    public Map<String, LocalDate> findAll() {
        return new TreeMap<>(entries);
    }

    @Override
    public Optional<LocalDate> findLastBought(String ticker) {
        return Optional.ofNullable(entries.get(ticker));
    }

    @Override
    public void save(String ticker, LocalDate lastBought) {
        entries.put(ticker, lastBought);
    }

    @Override
    public void saveAll(Map<String, LocalDate> values) {
        entries.putAll(values);
    }
}
