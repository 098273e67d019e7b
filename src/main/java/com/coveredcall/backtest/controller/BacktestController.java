package com.coveredcall.backtest.controller;

import com.coveredcall.backtest.dto.BacktestRequest;
import com.coveredcall.backtest.dto.BacktestResult;
import com.coveredcall.backtest.dto.CompareRequest;
import com.coveredcall.backtest.dto.OptimizationResult;
import com.coveredcall.backtest.dto.OptimizeRequest;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.backtest.service.BacktestService;
import com.coveredcall.dto.ApiResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for covered call backtesting.
 *
 * Provides endpoints for:
 * - Running a backtest over a supplied daily price series
 * - Comparing several strategy configurations on the same series
 * - Ranking strike/expiration combos for a spot price
 * - Retrieving results and the application's default configuration
 *
 * Errors are mapped to {@link ApiResponse} envelopes by the global exception handler.
 */
@RestController
@RequestMapping("/api/backtest")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Backtesting", description = "Covered call backtesting over daily price history")
public class BacktestController {

    private final BacktestService backtestService;

    @PostMapping("/run")
    @Operation(
            summary = "Run a covered call backtest",
            description = "Simulate the strategy day by day over the supplied price series. " +
                    "Returns the equity curve, trade log and summary statistics."
    )
    public ResponseEntity<ApiResponse<BacktestResult>> runBacktest(
            @Valid @RequestBody BacktestRequest request) {

        log.info("Backtest request received: bars={}, customConfig={}",
                request.getPriceSeries().size(), request.getConfig() != null);

        BacktestResult result = backtestService.run(request);
        return ResponseEntity.ok(ApiResponse.success("Backtest completed successfully", result));
    }

    @PostMapping(value = "/run/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(
            summary = "Run a backtest and return a text report",
            description = "Same simulation as /run, rendered as a plain-text report."
    )
    public ResponseEntity<String> runBacktestReport(@Valid @RequestBody BacktestRequest request) {
        BacktestResult result = backtestService.run(request);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(backtestService.report(result));
    }

    @PostMapping("/compare")
    @Operation(
            summary = "Compare strategy configurations",
            description = "Run each configuration independently against the same price series. " +
                    "A configuration that fails is returned with status FAILED; the others are unaffected."
    )
    public ResponseEntity<ApiResponse<List<BacktestResult>>> compare(
            @Valid @RequestBody CompareRequest request) {

        log.info("Compare request received: {} configurations, bars={}",
                request.getConfigs().size(), request.getPriceSeries().size());

        List<BacktestResult> results = backtestService.compare(request);
        long failed = results.stream().filter(r -> !r.isCompleted()).count();
        String message = String.format("Comparison completed: %d configurations, %d failed",
                results.size(), failed);
        return ResponseEntity.ok(ApiResponse.success(message, results));
    }

    @PostMapping("/optimize")
    @Operation(
            summary = "Rank strike and expiration combos",
            description = "Score every eligible strike/DTE pair for a spot price by income, " +
                    "delta sweet spot and upside room."
    )
    public ResponseEntity<ApiResponse<OptimizationResult>> optimize(
            @Valid @RequestBody OptimizeRequest request) {

        OptimizationResult result = backtestService.optimize(request);
        return ResponseEntity.ok(ApiResponse.success(
                String.format("%d combos ranked", result.rankings().size()), result));
    }

    @PostMapping(value = "/optimize/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Rank strike and expiration combos as a text table")
    public ResponseEntity<String> optimizeReport(@Valid @RequestBody OptimizeRequest request) {
        OptimizationResult result = backtestService.optimize(request);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(backtestService.report(result));
    }

    @GetMapping("/result/{backtestId}")
    @Operation(summary = "Get a backtest result by id")
    public ResponseEntity<ApiResponse<BacktestResult>> getResult(
            @PathVariable @Parameter(description = "Backtest id returned by /run or /compare") String backtestId) {
        return ResponseEntity.ok(ApiResponse.success(backtestService.getResult(backtestId)));
    }

    @GetMapping("/defaults")
    @Operation(summary = "Get the default strategy configuration")
    public ResponseEntity<ApiResponse<StrategyConfig>> getDefaults() {
        return ResponseEntity.ok(ApiResponse.success(backtestService.defaultConfig()));
    }
}
