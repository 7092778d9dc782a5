package com.tradepilot.backend.service;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.model.CooldownEntry;
import com.tradepilot.backend.repository.CooldownRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps recently bought tickers out of the next selections. A ticker bought on
 * day D is blocked while fewer than {@code strategy.cooldown.days} calendar
 * days have passed since D.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CooldownTracker {

    private final CooldownRepository cooldownRepository;
    private final StrategyProperties strategyProperties;
    private final Clock clock;

    public boolean isBlocked(String ticker, LocalDate today) {
        return remainingDays(ticker, today) > 0;
    }

    public long remainingDays(String ticker, LocalDate today) {
        if (ticker == null || ticker.isBlank()) {
            return 0;
        }
        return lastBought(ticker)
                .map(date -> strategyProperties.getCooldown().getDays() - ChronoUnit.DAYS.between(date, today))
                .map(days -> Math.max(0, days))
                .orElse(0L);
    }

    public Optional<LocalDate> lastBought(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return Optional.empty();
        }
        return cooldownRepository.findLastBought(normalize(ticker));
    }

    public void record(String ticker) {
        record(ticker, LocalDate.now(clock));
    }

    public void record(String ticker, LocalDate date) {
        if (ticker == null || ticker.isBlank()) {
            return;
        }
        cooldownRepository.save(normalize(ticker), date);
        log.debug("Recorded cooldown for {} on {}", ticker, date);
    }

    public void recordAll(Collection<String> tickers, LocalDate date) {
        Map<String, LocalDate> entries = new LinkedHashMap<>();
        tickers.stream()
                .filter(ticker -> ticker != null && !ticker.isBlank())
                .forEach(ticker -> entries.put(normalize(ticker), date));
        if (!entries.isEmpty()) {
            cooldownRepository.saveAll(entries);
        }
    }

    /**
     * Tickers currently blocked, in alphabetical order.
     */
    public List<String> blockedTickers(LocalDate today) {
        return entries().stream()
                .filter(entry -> strategyProperties.getCooldown().getDays()
                        - ChronoUnit.DAYS.between(entry.lastBought(), today) > 0)
                .map(CooldownEntry::ticker)
                .toList();
    }

    public List<CooldownEntry> entries() {
        return cooldownRepository.findAll().entrySet().stream()
                .map(entry -> new CooldownEntry(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static String normalize(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }
}
