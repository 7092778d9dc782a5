package com.tradepilot.backend.repository;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * Ticker to last successful buy date. Entries are never removed; staleness is
 * decided by the reader.
 */
public interface CooldownRepository {

    Map<String, LocalDate> findAll();

    Optional<LocalDate> findLastBought(String ticker);

    void save(String ticker, LocalDate lastBought);

    void saveAll(Map<String, LocalDate> entries);
}
