package com.tradepilot.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.backend.repository.CooldownRepository;
import com.tradepilot.backend.repository.CycleMarkerRepository;
import com.tradepilot.backend.repository.InMemoryCooldownRepository;
import com.tradepilot.backend.repository.InMemoryCycleMarkerRepository;
import com.tradepilot.backend.repository.JsonFileCooldownRepository;
import com.tradepilot.backend.repository.JsonFileCycleMarkerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public CooldownRepository cooldownRepository(StrategyProperties strategyProperties, ObjectMapper objectMapper) {
        StrategyProperties.Cooldown cooldown = strategyProperties.getCooldown();
        if (cooldown.getStorage() == StrategyProperties.Storage.MEMORY) {
            log.info("Cooldown store: in-memory");
            return new InMemoryCooldownRepository();
        }
        log.info("Cooldown store: {}", Path.of(cooldown.getPath()).toAbsolutePath());
        return new JsonFileCooldownRepository(Path.of(cooldown.getPath()), objectMapper);
    }

    @Bean
    public CycleMarkerRepository cycleMarkerRepository(StrategyProperties strategyProperties, ObjectMapper objectMapper) {
        StrategyProperties.Cycle cycle = strategyProperties.getCycle();
        if (cycle.getMarkerStorage() == StrategyProperties.Storage.MEMORY) {
            return new InMemoryCycleMarkerRepository();
        }
        return new JsonFileCycleMarkerRepository(Path.of(cycle.getMarkerPath()), objectMapper);
    }
}
