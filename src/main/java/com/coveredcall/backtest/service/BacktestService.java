package com.coveredcall.backtest.service;

import com.coveredcall.backtest.dto.BacktestRequest;
import com.coveredcall.backtest.dto.BacktestResult;
import com.coveredcall.backtest.dto.CompareRequest;
import com.coveredcall.backtest.dto.OptimizationResult;
import com.coveredcall.backtest.dto.OptimizeRequest;
import com.coveredcall.backtest.dto.PriceBar;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.backtest.dto.StrikeAnalysis;
import com.coveredcall.backtest.engine.BacktestEngine;
import com.coveredcall.backtest.engine.StrategyConfigValidator;
import com.coveredcall.backtest.optimizer.PremiumOptimizer;
import com.coveredcall.backtest.pricing.PricingModel;
import com.coveredcall.backtest.report.BacktestReportFormatter;
import com.coveredcall.config.CoveredCallProperties;
import com.coveredcall.exception.BacktestException;
import com.coveredcall.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Orchestrates backtest execution: request defaults, validation, the engine run,
 * and result bookkeeping.
 * <p>
 * The engine itself is deterministic and carries no identity; this layer assigns
 * each result an id and an execution duration and keeps it for later lookup.
 * Comparison sweeps fan out to the {@code backtestExecutor} pool, one isolated run
 * per configuration, and come back in request order.
 */
@Service
@Slf4j
public class BacktestService {

    private static final int DEFAULT_TOP_N = 10;

    private final BacktestEngine engine;
    private final CoveredCallProperties properties;
    private final Executor backtestExecutor;

    /** In-memory result cache. */
    private final Map<String, BacktestResult> resultCache = new ConcurrentHashMap<>();
    private final Queue<String> cacheOrder = new ConcurrentLinkedQueue<>();

    public BacktestService(BacktestEngine engine,
                           CoveredCallProperties properties,
                           @Qualifier("backtestExecutor") Executor backtestExecutor) {
        this.engine = engine;
        this.properties = properties;
        this.backtestExecutor = backtestExecutor;
    }

    // ==================== SINGLE RUN ====================

    /**
     * Run one configuration synchronously. Invalid input propagates as a
     * {@link BacktestException}.
     */
    public BacktestResult run(BacktestRequest request) {
        checkEnabled();
        StrategyConfig config = resolveConfig(request.getConfig());
        String backtestId = UUID.randomUUID().toString();
        long startMs = System.currentTimeMillis();

        log.info("Starting backtest {}: symbol={}, bars={}", backtestId, config.getSymbol(),
                request.getPriceSeries() == null ? 0 : request.getPriceSeries().size());

        BacktestResult result = engine.run(request.getPriceSeries(), config).toBuilder()
                .backtestId(backtestId)
                .executionDurationMs(System.currentTimeMillis() - startMs)
                .build();
        cacheResult(result);

        log.info("Backtest {} completed in {}ms: return={}%, called away={}", backtestId,
                result.getExecutionDurationMs(),
                String.format("%.2f", result.getSummary().getTotalReturnPct()),
                result.getSummary().getCalledAwayCount());
        return result;
    }

    // ==================== COMPARISON ====================

    /**
     * Run every configuration against the same series. Failures are isolated per
     * configuration and reported as FAILED results.
     */
    public List<BacktestResult> compare(CompareRequest request) {
        checkEnabled();
        if (request.getConfigs() == null || request.getConfigs().isEmpty()) {
            throw new InvalidInputException("At least one configuration is required for comparison");
        }
        List<PriceBar> series = request.getPriceSeries() == null
                ? List.of() : Collections.unmodifiableList(new ArrayList<>(request.getPriceSeries()));
        List<StrategyConfig> configs = new ArrayList<>();
        for (StrategyConfig config : request.getConfigs()) {
            configs.add(resolveConfig(config));
        }

        boolean sequential = Boolean.TRUE.equals(request.getRunSequentially());
        log.info("Starting comparison: {} configurations, {} bars, mode={}", configs.size(), series.size(),
                sequential ? "sequential" : "parallel");

        List<BacktestResult> results = new ArrayList<>(configs.size());
        if (sequential) {
            for (StrategyConfig config : configs) {
                results.add(runGuarded(series, config));
            }
        } else {
            List<CompletableFuture<BacktestResult>> futures = new ArrayList<>(configs.size());
            for (StrategyConfig config : configs) {
                CompletableFuture<BacktestResult> future;
                try {
                    future = CompletableFuture
                            .supplyAsync(() -> timed(() -> engine.runIsolated(series, config)), backtestExecutor)
                            .exceptionally(ex -> unexpectedFailure(config, ex));
                } catch (RejectedExecutionException e) {
                    // Pool saturated: run this configuration on the calling thread
                    log.warn("Backtest executor rejected configuration {}, running inline", config.getSymbol());
                    future = CompletableFuture.completedFuture(runGuarded(series, config));
                }
                futures.add(future);
            }
            for (CompletableFuture<BacktestResult> future : futures) {
                results.add(future.join());
            }
        }

        results.forEach(this::cacheResult);
        long completed = results.stream().filter(BacktestResult::isCompleted).count();
        log.info("Comparison finished: {} completed, {} failed", completed, results.size() - completed);
        return results;
    }

    // ==================== OPTIMIZER ====================

    /**
     * Rank strike/expiration combos for a spot price. Volatility is taken from the
     * request or estimated from the supplied price history.
     */
    public OptimizationResult optimize(OptimizeRequest request) {
        checkEnabled();
        StrategyConfig config = resolveConfig(request.getConfig());
        StrategyConfigValidator.validate(config);
        PricingModel pricingModel = PricingModel.fromConfig(config);

        double volatility;
        if (request.getVolatility() != null) {
            volatility = request.getVolatility();
            if (!(volatility > 0) || Double.isInfinite(volatility)) {
                throw new InvalidInputException("Volatility must be positive, got " + volatility);
            }
        } else if (request.getPriceHistory() != null && !request.getPriceHistory().isEmpty()) {
            volatility = pricingModel.estimateVolatility(request.getPriceHistory(), config.getVolatilityWindowDays());
        } else {
            throw new InvalidInputException("Either volatility or priceHistory is required");
        }

        List<Double> strikes = request.getStrikes() != null && !request.getStrikes().isEmpty()
                ? request.getStrikes() : config.getStrikeCandidates();
        List<Integer> dtes = request.getDtes() != null && !request.getDtes().isEmpty()
                ? request.getDtes() : properties.getOptimizerDtes();
        int topN = request.getTopN() != null ? request.getTopN() : DEFAULT_TOP_N;
        if (topN <= 0) {
            throw new InvalidInputException("topN must be positive, got " + topN);
        }

        List<StrikeAnalysis> ranked = new PremiumOptimizer(config, pricingModel)
                .optimize(request.getSpot(), strikes, dtes, volatility);
        List<StrikeAnalysis> top = List.copyOf(ranked.subList(0, Math.min(topN, ranked.size())));

        log.info("Optimized spot={} iv={}: {} combos ranked, returning {}", request.getSpot(),
                String.format("%.3f", volatility), ranked.size(), top.size());
        return new OptimizationResult(request.getSpot(), volatility, top);
    }

    // ==================== RESULT ACCESS ====================

    public BacktestResult getResult(String backtestId) {
        BacktestResult result = resultCache.get(backtestId);
        if (result == null) {
            throw new BacktestException(BacktestException.ErrorCode.RESULT_NOT_FOUND,
                    "No backtest result with id " + backtestId);
        }
        return result;
    }

    public Collection<BacktestResult> getAllResults() {
        return Collections.unmodifiableCollection(resultCache.values());
    }

    public StrategyConfig defaultConfig() {
        return properties.toStrategyConfig();
    }

    public String report(BacktestResult result) {
        return BacktestReportFormatter.format(result);
    }

    public String report(OptimizationResult result) {
        return BacktestReportFormatter.formatAnalysis(result.spot(), result.volatility(), result.rankings(),
                result.rankings().size());
    }

    // ==================== INTERNAL HELPERS ====================

    private void checkEnabled() {
        if (!properties.getBacktest().isEnabled()) {
            throw new BacktestException(BacktestException.ErrorCode.BACKTEST_DISABLED,
                    "Backtest module is disabled in configuration");
        }
    }

    private StrategyConfig resolveConfig(StrategyConfig requested) {
        return requested != null ? requested : properties.toStrategyConfig();
    }

    private BacktestResult runGuarded(List<PriceBar> series, StrategyConfig config) {
        try {
            return timed(() -> engine.runIsolated(series, config));
        } catch (RuntimeException e) {
            return unexpectedFailure(config, e);
        }
    }

    private BacktestResult timed(Supplier<BacktestResult> run) {
        long startMs = System.currentTimeMillis();
        BacktestResult result = run.get();
        return result.toBuilder()
                .backtestId(UUID.randomUUID().toString())
                .executionDurationMs(System.currentTimeMillis() - startMs)
                .build();
    }

    private BacktestResult unexpectedFailure(StrategyConfig config, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        log.error("Unexpected error in comparison run: {}", cause.getMessage(), cause);
        return BacktestResult.builder()
                .backtestId(UUID.randomUUID().toString())
                .status(BacktestResult.BacktestStatus.FAILED)
                .config(config)
                .equityCurve(Collections.emptyList())
                .trades(Collections.emptyList())
                .cashFloorWarnings(Collections.emptyList())
                .errorCode(BacktestException.ErrorCode.SIMULATION_ERROR.name())
                .errorMessage("Unexpected error: " + cause.getMessage())
                .build();
    }

    private void cacheResult(BacktestResult result) {
        // Evict oldest once over the limit
        while (resultCache.size() >= properties.getBacktest().getMaxCacheSize() && !cacheOrder.isEmpty()) {
            String oldest = cacheOrder.poll();
            if (oldest != null) {
                resultCache.remove(oldest);
            }
        }
        resultCache.put(result.getBacktestId(), result);
        cacheOrder.add(result.getBacktestId());
    }
}
