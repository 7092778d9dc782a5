package com.tradepilot.backend.controller;

import com.tradepilot.backend.dto.CooldownStatusResponse;
import com.tradepilot.backend.exception.BadRequestException;
import com.tradepilot.backend.service.CooldownTracker;
import com.tradepilot.backend.service.CycleResult;
import com.tradepilot.backend.service.DecisionCycleService;
import com.tradepilot.backend.service.SellCheckResult;
import com.tradepilot.backend.service.SellCheckService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CycleController {

    private static final Pattern TICKER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9.\\-]{0,14}");

    private final DecisionCycleService decisionCycleService;
    private final SellCheckService sellCheckService;
    private final CooldownTracker cooldownTracker;
    private final Clock clock;

    @PostMapping("/cycle/run")
    public ResponseEntity<CycleResult> runCycle(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate runDate = date == null ? LocalDate.now(clock) : date;
        log.info("Manual decision cycle requested for {}", runDate);
        return ResponseEntity.ok(decisionCycleService.runCycle(runDate));
    }

    @PostMapping("/sell-checks/run")
    public ResponseEntity<SellCheckResult> runSellChecks(
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate runDate = date == null ? LocalDate.now(clock) : date;
        log.info("Manual sell checks requested for {} (dryRun={})", runDate, dryRun);
        return ResponseEntity.ok(sellCheckService.runSellChecks(runDate, dryRun));
    }

    @GetMapping("/cooldowns")
    public ResponseEntity<List<CooldownStatusResponse>> cooldowns() {
        LocalDate today = LocalDate.now(clock);
        List<CooldownStatusResponse> response = cooldownTracker.entries().stream()
                .map(entry -> toResponse(entry.ticker(), today))
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/cooldowns/{ticker}")
    public ResponseEntity<CooldownStatusResponse> cooldown(@PathVariable String ticker) {
        if (!TICKER.matcher(ticker).matches()) {
            throw new BadRequestException("Invalid ticker: " + ticker);
        }
        return ResponseEntity.ok(toResponse(ticker.toUpperCase(Locale.ROOT), LocalDate.now(clock)));
    }

    private CooldownStatusResponse toResponse(String ticker, LocalDate today) {
        return CooldownStatusResponse.builder()
                .ticker(ticker)
                .lastBought(cooldownTracker.lastBought(ticker).orElse(null))
                .blocked(cooldownTracker.isBlocked(ticker, today))
                .remainingDays(cooldownTracker.remainingDays(ticker, today))
                .build();
    }
}
