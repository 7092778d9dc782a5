package com.tradepilot.backend.repository;

import java.time.LocalDate;
import java.util.Optional;

public interface CycleMarkerRepository {

    Optional<LocalDate> findLastRun();

    void saveLastRun(LocalDate date);
}
