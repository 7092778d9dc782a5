package com.tradepilot.backend.repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryCycleMarkerRepository implements CycleMarkerRepository {

    private final AtomicReference<LocalDate> lastRun = new AtomicReference<>();

    @Override
    public Optional<LocalDate> findLastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    @Override
    public void saveLastRun(LocalDate date) {
        lastRun.set(date);
    }
}
