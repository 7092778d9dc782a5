package com.tradepilot.backend.config;

import com.tradepilot.backend.model.StrategyProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "strategy")
@Data
@Validated
public class StrategyProperties {

    @Valid
    private Conviction conviction = new Conviction();
    @Valid
    private Merge merge = new Merge();
    @Valid
    private Cooldown cooldown = new Cooldown();
    @Valid
    private Cycle cycle = new Cycle();
    @Valid
    private Decision decision = new Decision();
    @Valid
    private Map<String, Profile> profiles = new LinkedHashMap<>();

    /**
     * Enabled profiles in declaration order. Falls back to a single
     * {@code default} profile when none are configured.
     */
    public List<StrategyProfile> activeProfiles() {
        List<StrategyProfile> active = new ArrayList<>();
        if (profiles.isEmpty()) {
            active.add(new Profile().toProfile("default"));
            return active;
        }
        profiles.forEach((name, profile) -> {
            if (profile.isEnabled()) {
                active.add(profile.toProfile(name));
            }
        });
        return active;
    }

    @Data
    public static class Conviction {
        @Min(1)
        private int lookbackDays = 7;
        @Min(1)
        private int topN = 25;
        @PositiveOrZero
        private double decayRate = 0.2;
        @Positive
        private double csuiteMultiplier = 3.0;
        @Min(1)
        private int minInsidersForCluster = 2;
        @PositiveOrZero
        private double csuiteStakeThresholdPct = 3.0;
        @NotEmpty
        private List<String> csuiteTitles = new ArrayList<>(List.of("CEO", "CFO", "COO", "President", "CTO", "Chairman"));
    }

    @Data
    public static class Merge {
        @Min(1)
        private int candidateLimit = 25;
        private List<String> sourcePriority = new ArrayList<>(List.of("insider", "screener", "earnings", "social"));
        private Map<String, Integer> maxSlotsPerSource = new LinkedHashMap<>();
        private List<String> excludedTickers = new ArrayList<>();
        @Min(1)
        private int minTickerLength = 3;
        private List<String> noisySources = new ArrayList<>(List.of("social"));
        @Valid
        private Enrichment enrichment = new Enrichment();
    }

    @Data
    public static class Enrichment {
        @Min(1)
        private int parallelism = 4;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Cooldown {
        @Min(1)
        private int days = 3;
        private Storage storage = Storage.FILE;
        private String path = "recently_traded.json";
    }

    @Data
    public static class Cycle {
        @Min(0)
        private int minTradingDaysBetweenRuns = 1;
        private Duration timeout = Duration.ofMinutes(10);
        private Storage markerStorage = Storage.FILE;
        private String markerPath = "last_cycle.json";
        private String timezone = "Europe/Berlin";
        private boolean schedulerEnabled = false;
        private String cron = "0 30 15 * * TUE,FRI";
        private boolean sellCheckSchedulerEnabled = false;
        private String sellCheckCron = "0 0 10,16 * * MON-FRI";
    }

    @Data
    public static class Decision {
        @Min(1)
        private int targetPositions = 3;
    }

    @Data
    public static class Profile {
        private boolean enabled = true;
        private String accountId = "practice";
        @Positive
        private double budgetPerRun = 10.0;
        @Min(1)
        private Integer maxPicksPerRun;
        @Positive
        private double minTradeUnit = 1.0;
        @Positive
        private double stopLossPct = 10.0;
        @Positive
        private double takeProfitPct = 15.0;
        @Min(1)
        private int maxHoldDays = 5;

        StrategyProfile toProfile(String name) {
            return StrategyProfile.builder()
                    .name(name)
                    .accountId(accountId)
                    .budgetPerRun(budgetPerRun)
                    .maxPicksPerRun(maxPicksPerRun)
                    .minTradeUnit(minTradeUnit)
                    .stopLossPct(stopLossPct)
                    .takeProfitPct(takeProfitPct)
                    .maxHoldDays(maxHoldDays)
                    .build();
        }
    }

    public enum Storage {
        MEMORY,
        FILE
    }
}
