package com.tradepilot.backend.service;

import com.tradepilot.backend.config.StrategyProperties;
import com.tradepilot.backend.model.Candidate;
import com.tradepilot.backend.model.Pick;
import com.tradepilot.backend.model.Position;
import com.tradepilot.backend.model.StrategyProfile;
import com.tradepilot.backend.service.broker.BrokerPort;
import com.tradepilot.backend.service.source.SignalSourceRegistry;
import com.tradepilot.backend.trading.pipeline.DecisionStage;
import com.tradepilot.backend.trading.pipeline.ExecutionRequest;
import com.tradepilot.backend.trading.pipeline.ExecutionSummary;
import com.tradepilot.backend.trading.pipeline.MergeResult;
import com.tradepilot.backend.trading.pipeline.SignalMerger;
import com.tradepilot.backend.trading.pipeline.TradeExecutor;
import com.tradepilot.backend.trading.pipeline.TradeResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one decision cycle: gate, merge, decide and execute per strategy
 * profile. The whole cycle runs on the cycle executor under a hard timeout;
 * per-source and per-ticker failures only show up in the result.
 */
@Slf4j
@Service
public class DecisionCycleService {

    static final String MDC_CYCLE_DATE = "cycleDate";

    private final CycleGate cycleGate;
    private final SignalSourceRegistry signalSourceRegistry;
    private final SignalMerger signalMerger;
    private final DecisionStage decisionStage;
    private final TradeExecutor tradeExecutor;
    private final BrokerPort brokerPort;
    private final StrategyProperties strategyProperties;
    private final MetricsService metricsService;
    private final AsyncTaskExecutor cycleExecutor;
    private final Clock clock;

    public DecisionCycleService(CycleGate cycleGate,
                                SignalSourceRegistry signalSourceRegistry,
                                SignalMerger signalMerger,
                                DecisionStage decisionStage,
                                TradeExecutor tradeExecutor,
                                BrokerPort brokerPort,
                                StrategyProperties strategyProperties,
                                MetricsService metricsService,
                                @Qualifier("cycleExecutor") AsyncTaskExecutor cycleExecutor,
                                Clock clock) {
        this.cycleGate = cycleGate;
        this.signalSourceRegistry = signalSourceRegistry;
        this.signalMerger = signalMerger;
        this.decisionStage = decisionStage;
        this.tradeExecutor = tradeExecutor;
        this.brokerPort = brokerPort;
        this.strategyProperties = strategyProperties;
        this.metricsService = metricsService;
        this.cycleExecutor = cycleExecutor;
        this.clock = clock;
    }

    public CycleResult runCycle() {
        return runCycle(LocalDate.now(clock));
    }

    public CycleResult runCycle(LocalDate date) {
        GateDecision gate = cycleGate.tryAcquire(date);
        if (!gate.allowed()) {
            log.info("Decision cycle for {} skipped: {}", date, gate.reason());
            return finish(CycleResult.skipped(date, gate.reason()));
        }

        MDC.put(MDC_CYCLE_DATE, date.toString());
        CycleProgress progress = new CycleProgress();
        boolean completed = false;
        Future<CycleResult> future = null;
        try {
            log.info("Decision cycle for {} started", date);
            future = cycleExecutor.submit(() -> {
                MDC.put(MDC_CYCLE_DATE, date.toString());
                try {
                    return execute(date, progress);
                } finally {
                    MDC.remove(MDC_CYCLE_DATE);
                }
            });
            CycleResult result = future.get(strategyProperties.getCycle().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            completed = result.status() == CycleStatus.OK;
            return finish(result);
        } catch (TimeoutException ex) {
            progress.abort();
            future.cancel(true);
            completed = progress.anyBought();
            log.warn("Decision cycle for {} aborted after {}", date, strategyProperties.getCycle().getTimeout());
            return finish(CycleResult.of(CycleStatus.TIMED_OUT, date,
                    "Cycle exceeded " + strategyProperties.getCycle().getTimeout(), progress));
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.error("Decision cycle for {} failed", date, cause);
            completed = progress.anyBought();
            return finish(CycleResult.of(CycleStatus.FAILED, date, cause.getMessage(), progress));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            progress.abort();
            future.cancel(true);
            completed = progress.anyBought();
            return finish(CycleResult.of(CycleStatus.FAILED, date, "Interrupted while waiting for cycle", progress));
        } catch (TaskRejectedException ex) {
            log.error("Decision cycle for {} could not be scheduled", date, ex);
            return finish(CycleResult.of(CycleStatus.FAILED, date, ex.getMessage(), progress));
        } finally {
            cycleGate.release(date, completed);
            MDC.remove(MDC_CYCLE_DATE);
        }
    }

    CycleResult execute(LocalDate date, CycleProgress progress) {
        MergeResult merge = signalMerger.merge(signalSourceRegistry.sources(), date);
        merge.unavailableSources().forEach(metricsService::recordSourceUnavailable);
        progress.mergeDone(merge);
        if (merge.candidates().isEmpty()) {
            log.info("No qualifying candidates for {}", date);
            return CycleResult.of(CycleStatus.SKIPPED, date, "No qualifying candidates", progress);
        }
        log.info("{} candidates: {}", merge.candidates().size(),
                merge.candidates().stream().map(Candidate::ticker).toList());

        for (StrategyProfile profile : strategyProperties.activeProfiles()) {
            if (progress.isAborted() || Thread.currentThread().isInterrupted()) {
                log.warn("Cycle aborted before profile {}", profile.name());
                break;
            }
            runProfile(profile, merge.candidates(), date, progress);
        }
        return CycleResult.of(CycleStatus.OK, date, null, progress);
    }

    private void runProfile(StrategyProfile profile, List<Candidate> candidates, LocalDate date, CycleProgress progress) {
        List<Position> portfolio;
        try {
            portfolio = brokerPort.openPositions(profile.accountId());
        } catch (RuntimeException ex) {
            log.warn("Could not load positions of {} for profile {}, assuming none: {}",
                    profile.accountId(), profile.name(), ex.getMessage());
            portfolio = List.of();
        }

        List<Pick> picks;
        try {
            picks = decisionStage.decide(candidates, portfolio, profile.budget());
        } catch (RuntimeException ex) {
            log.error("Decision stage failed for profile {}", profile.name(), ex);
            progress.error(profile.name() + ": decision stage failed: " + ex.getMessage());
            return;
        }
        log.info("Profile {}: {} picks for budget {}", profile.name(), picks.size(), profile.budget());

        ExecutionSummary summary = tradeExecutor.execute(ExecutionRequest.forProfile(profile)
                .picks(picks)
                .runDate(date)
                .listener(result -> onTradeResult(profile, result, progress))
                .abortSignal(progress::isAborted)
                .build());
        progress.profileDone(profile.name(), summary);
        log.info("Profile {}: spent {} of {} ({}%)", profile.name(), summary.totalSpent(),
                summary.budget(), summary.budgetUtilisationPct());
    }

    private void onTradeResult(StrategyProfile profile, TradeResult result, CycleProgress progress) {
        progress.tradeResult(profile.name(), result);
        switch (result.status()) {
            case BOUGHT -> metricsService.incrementOrdersPlaced();
            case FAILED -> metricsService.recordOrderFailure(result.reason().name());
            default -> {
            }
        }
    }

    private CycleResult finish(CycleResult result) {
        metricsService.recordCycle(result.status().name());
        return result;
    }
}
