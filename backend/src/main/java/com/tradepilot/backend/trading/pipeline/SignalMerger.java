package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.exception.SourceUnavailableException;
import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.model.SourceFeed;
import com.tradepilot.backend.model.SourceHit;
import com.tradepilot.backend.service.CooldownTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Unions the candidate lists of independent signal sources into one ranked,
 * capped candidate set.
 *
 * <p>Tickers confirmed by two or more sources are admitted first. Remaining
 * slots are filled source by source in declared priority order, each source
 * contributing its best not-yet-admitted tickers. Tickers still in cooldown are
 * removed afterwards, so the result may be shorter than the limit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalMerger {

    private final StrategyProperties strategyProperties;
    private final CooldownTracker cooldownTracker;
    private final CandidateEnricher candidateEnricher;

    public MergeResult merge(List<SignalSource> sources, LocalDate today) {
        List<String> unavailable = new ArrayList<>();
        List<SourceFeed> feeds = collect(sources, today, unavailable);

        List<Candidate> selected = select(feeds);
        List<Candidate> eligible = new ArrayList<>();
        List<String> blocked = new ArrayList<>();
        for (Candidate candidate : selected) {
            if (cooldownTracker.isBlocked(candidate.ticker(), today)) {
                blocked.add(candidate.ticker());
            } else {
                eligible.add(candidate);
            }
        }
        if (!blocked.isEmpty()) {
            log.info("Removed {} recently traded tickers: {}", blocked.size(), blocked);
        }

        List<Candidate> enriched = candidateEnricher.enrich(eligible);
        log.info("Merged {} feeds into {} candidates ({} unavailable sources)",
                feeds.size(), enriched.size(), unavailable.size());
        return new MergeResult(enriched, List.copyOf(unavailable), List.copyOf(blocked));
    }

    /**
     * Fetches every source; a failing source is left out and reported in
     * {@code unavailable}.
     */
    public List<SourceFeed> collect(List<SignalSource> sources, LocalDate today, List<String> unavailable) {
        List<SourceFeed> feeds = new ArrayList<>();
        for (SignalSource source : sources) {
            try {
                List<SourceHit> hits = source.fetch(today);
                feeds.add(new SourceFeed(normalize(source.name()), hits));
                log.debug("Source {} returned {} hits", source.name(), hits == null ? 0 : hits.size());
            } catch (SourceUnavailableException ex) {
                log.warn("Source {} unavailable, continuing without it: {}", source.name(), ex.getMessage());
                unavailable.add(normalize(source.name()));
            } catch (RuntimeException ex) {
                log.warn("Source {} failed, continuing without it", source.name(), ex);
                unavailable.add(normalize(source.name()));
            }
        }
        return feeds;
    }

    /**
     * Two-pass selection over already collected feeds. Does not consult the
     * cooldown store.
     */
    public List<Candidate> select(List<SourceFeed> feeds) {
        StrategyProperties.Merge config = strategyProperties.getMerge();
        TickerFilter filter = new TickerFilter(config);
        int limit = config.getCandidateLimit();

        List<SourceFeed> ordered = new ArrayList<>(feeds);
        ordered.sort(Comparator.comparingInt((SourceFeed feed) -> priorityOf(feed.source()))
                .thenComparing(SourceFeed::source));

        Map<String, List<SourceHit>> rankedBySource = new LinkedHashMap<>();
        Map<String, List<SourceHit>> hitsByTicker = new LinkedHashMap<>();
        for (SourceFeed feed : ordered) {
            List<SourceHit> ranked = rankedBySource.computeIfAbsent(feed.source(), key -> new ArrayList<>());
            Set<String> seen = new HashSet<>();
            feed.hits().stream()
                    .sorted(Comparator.comparingInt(SourceHit::rank))
                    .filter(hit -> filter.accepts(hit.ticker(), feed.source()))
                    .filter(hit -> seen.add(hit.ticker()))
                    .map(hit -> hit.source().equals(feed.source()) ? hit
                            : new SourceHit(hit.ticker(), feed.source(), hit.rank(), hit.score(), hit.evidence()))
                    .forEach(hit -> {
                        ranked.add(hit);
                        hitsByTicker.computeIfAbsent(hit.ticker(), key -> new ArrayList<>()).add(hit);
                    });
        }

        Set<String> admitted = new LinkedHashSet<>();

        // pass 1: confirmed by two or more distinct sources
        hitsByTicker.entrySet().stream()
                .filter(entry -> distinctSources(entry.getValue()) >= 2)
                .sorted(multiSourceOrder())
                .limit(limit)
                .forEach(entry -> admitted.add(entry.getKey()));

        // pass 2: fill by source priority
        for (Map.Entry<String, List<SourceHit>> entry : rankedBySource.entrySet()) {
            if (admitted.size() >= limit) {
                break;
            }
            Integer cap = config.getMaxSlotsPerSource().get(entry.getKey());
            int taken = 0;
            for (SourceHit hit : entry.getValue()) {
                if (admitted.size() >= limit || (cap != null && taken >= cap)) {
                    break;
                }
                if (admitted.add(hit.ticker())) {
                    taken++;
                }
            }
        }

        List<Candidate> candidates = new ArrayList<>(admitted.size());
        for (String ticker : admitted) {
            List<SourceHit> hits = hitsByTicker.get(ticker);
            candidates.add(new Candidate(ticker, totalScore(hits), hits, null));
        }
        return candidates;
    }

    private Comparator<Map.Entry<String, List<SourceHit>>> multiSourceOrder() {
        Comparator<Map.Entry<String, List<SourceHit>>> bySourceCount =
                Comparator.comparingInt(entry -> distinctSources(entry.getValue()));
        Comparator<Map.Entry<String, List<SourceHit>>> byScore =
                Comparator.comparingDouble(entry -> totalScore(entry.getValue()));
        Comparator<Map.Entry<String, List<SourceHit>>> byPriority =
                Comparator.comparingInt(entry -> bestPriority(entry.getValue()));
        return bySourceCount.reversed()
                .thenComparing(byScore.reversed())
                .thenComparing(byPriority)
                .thenComparing(Map.Entry::getKey);
    }

    int priorityOf(String source) {
        List<String> priority = strategyProperties.getMerge().getSourcePriority();
        for (int i = 0; i < priority.size(); i++) {
            if (normalize(priority.get(i)).equals(source)) {
                return i;
            }
        }
        return priority.size();
    }

    private int bestPriority(List<SourceHit> hits) {
        return hits.stream().mapToInt(hit -> priorityOf(hit.source())).min().orElse(Integer.MAX_VALUE);
    }

    private static int distinctSources(List<SourceHit> hits) {
        return (int) hits.stream().map(SourceHit::source).distinct().count();
    }

    private static double totalScore(List<SourceHit> hits) {
        return hits.stream().mapToDouble(SourceHit::score).sum();
    }

    private static String normalize(String source) {
        return source == null ? "" : source.trim().toLowerCase(Locale.ROOT);
    }
}
