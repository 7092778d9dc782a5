package com.tradepilot.backend.trading.pipeline;

import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.model.Enrichment;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Fetches supplementary per-ticker context concurrently. Each ticker is
 * bounded by the enrichment time limiter; a failed or slow lookup leaves that
 * candidate with empty enrichment instead of failing the batch.
 */
@Slf4j
@Service
public class CandidateEnricher {

    private final EnrichmentProvider enrichmentProvider;
    private final Executor enrichmentExecutor;
    private final TimeLimiter enrichmentTimeLimiter;
    private final ScheduledExecutorService enrichmentTimeoutScheduler;

    public CandidateEnricher(EnrichmentProvider enrichmentProvider,
                             @Qualifier("enrichmentExecutor") Executor enrichmentExecutor,
                             TimeLimiter enrichmentTimeLimiter,
                             @Qualifier("enrichmentTimeoutScheduler") ScheduledExecutorService enrichmentTimeoutScheduler) {
        this.enrichmentProvider = enrichmentProvider;
        this.enrichmentExecutor = enrichmentExecutor;
        this.enrichmentTimeLimiter = enrichmentTimeLimiter;
        this.enrichmentTimeoutScheduler = enrichmentTimeoutScheduler;
    }

    /**
     * Returns the candidates in their original order, each carrying its
     * enrichment or {@link Enrichment#empty()}.
     */
    public List<Candidate> enrich(List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        Enrichment[] slots = new Enrichment[candidates.size()];
        Arrays.fill(slots, Enrichment.empty());

        CompletableFuture<?>[] futures = new CompletableFuture<?>[candidates.size()];
        for (int i = 0; i < candidates.size(); i++) {
            int slot = i;
            String ticker = candidates.get(i).ticker();
            futures[i] = enrichmentTimeLimiter
                    .executeCompletionStage(enrichmentTimeoutScheduler, () -> lookup(ticker))
                    .toCompletableFuture()
                    .handle((enrichment, error) -> {
                        if (error != null) {
                            log.warn("Enrichment for {} failed: {}", ticker, rootMessage(error));
                            return Enrichment.empty();
                        }
                        return enrichment == null ? Enrichment.empty() : enrichment;
                    })
                    .thenAccept(enrichment -> slots[slot] = enrichment);
        }
        CompletableFuture.allOf(futures).join();

        List<Candidate> enriched = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            enriched.add(candidates.get(i).withEnrichment(slots[i]));
        }
        return enriched;
    }

    private CompletableFuture<Enrichment> lookup(String ticker) {
        try {
            return CompletableFuture.supplyAsync(() -> enrichmentProvider.fetch(ticker), enrichmentExecutor);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getClass().getSimpleName() + (current.getMessage() == null ? "" : ": " + current.getMessage());
    }
}
