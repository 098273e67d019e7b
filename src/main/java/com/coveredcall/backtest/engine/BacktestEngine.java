package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.BacktestResult;
import com.coveredcall.backtest.dto.BacktestResult.BacktestStatus;
import com.coveredcall.backtest.dto.BacktestSummary;
import com.coveredcall.backtest.dto.CashFloorAlert;
import com.coveredcall.backtest.dto.CashFloorEstimate;
import com.coveredcall.backtest.dto.EquityCurveSample;
import com.coveredcall.backtest.dto.Position;
import com.coveredcall.backtest.dto.PriceBar;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.backtest.monitor.CashFloorMonitor;
import com.coveredcall.backtest.optimizer.PremiumOptimizer;
import com.coveredcall.backtest.pricing.PricingModel;
import com.coveredcall.exception.BacktestException;
import com.coveredcall.exception.InsufficientHistoryException;
import com.coveredcall.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Day-by-day covered call simulation.
 * <p>
 * Each bar, in order:
 * <ol>
 *   <li>sample the cash floor</li>
 *   <li>estimate volatility from the trailing closes (seeded with the default during warm-up)</li>
 *   <li>let the {@link PositionEngine} resolve, roll or open the short call</li>
 *   <li>mark the open call to market</li>
 *   <li>append an {@link EquityCurveSample}: cash + shares * price - short call liability</li>
 * </ol>
 * The run buys the configured shares at the first close, so initial equity is
 * {@code shares * firstClose}.
 * <p>
 * The engine holds no state between runs: every run builds its own ledger, monitor
 * and pricing model, and the result carries no wall-clock data, so identical inputs
 * produce identical results. Instances can be shared across threads.
 */
@Slf4j
public class BacktestEngine {

    /**
     * Runs one configuration over the series.
     *
     * @throws InvalidInputException  if the configuration is out of range
     * @throws com.coveredcall.exception.DataIntegrityException if the series is empty, unordered or has gaps
     */
    public BacktestResult run(List<PriceBar> priceSeries, StrategyConfig config) {
        StrategyConfigValidator.validate(config);
        PriceSeriesValidator.validate(priceSeries, config.getMaxCalendarGapDays());
        List<PriceBar> series = List.copyOf(priceSeries);

        PricingModel pricingModel = PricingModel.fromConfig(config);
        PositionEngine positionEngine = new PositionEngine(config, pricingModel,
                new PremiumOptimizer(config, pricingModel));

        PriceBar first = series.get(0);
        CashFloorMonitor cashFloor = CashFloorMonitor.fromConfig(config, first.date());
        double initialEquity = first.close() * config.getShares();
        PositionLedger ledger = new PositionLedger(initialEquity);

        log.info("Starting backtest: symbol={}, bars={} ({} to {}), shares={}, minStrike={}, targetDte={}, rollDte={}",
                config.getSymbol(), series.size(), first.date(), series.get(series.size() - 1).date(),
                config.getShares(), config.getMinStrike(), config.getTargetDte(), config.getRollDteThreshold());

        positionEngine.openStockPosition(ledger, first);

        List<Double> closes = new ArrayList<>(series.size());
        List<EquityCurveSample> equityCurve = new ArrayList<>(series.size());
        List<String> warnings = new ArrayList<>();
        CashFloorAlert lastAlert = CashFloorAlert.NONE;
        boolean warmedUp = false;

        for (PriceBar bar : series) {
            closes.add(bar.close());

            CashFloorEstimate floor = cashFloor.sample(bar.date(), bar.close());
            if (floor.alert() != lastAlert) {
                if (floor.alert() != CashFloorAlert.NONE) {
                    warnings.add("[" + bar.date() + "] " + floor.warning());
                    log.warn("Cash floor {} on {}: {}", floor.alert(), bar.date(), floor.warning());
                }
                lastAlert = floor.alert();
            }

            double volatility;
            try {
                volatility = pricingModel.estimateVolatility(closes, config.getVolatilityWindowDays());
                if (!warmedUp) {
                    log.debug("Volatility window filled on {}: iv={}", bar.date(), volatility);
                    warmedUp = true;
                }
            } catch (InsufficientHistoryException e) {
                // Warm-up: not enough trailing bars yet
                volatility = config.getDefaultVolatility();
            }

            DayEvaluation day = positionEngine.evaluateDay(ledger, bar, volatility);

            double liability = markToMarket(ledger.getPosition(), bar, volatility, pricingModel, config);
            double equity = ledger.getCash() + ledger.getSharesHeld() * bar.close() - liability;

            equityCurve.add(new EquityCurveSample(
                    bar.date(),
                    bar.close(),
                    volatility,
                    ledger.getSharesHeld(),
                    ledger.getCash(),
                    liability,
                    day.premiumCollected(),
                    equity,
                    ledger.getStatus(),
                    day.outcome(),
                    floor.netCashPerShare(),
                    floor.breached()));
        }

        BacktestSummary summary = PerformanceCalculator.summarize(equityCurve, ledger, initialEquity);

        log.info("Backtest complete: {} bars, return={}%, sharpe={}, maxDD={}%, premium={}, calls sold={}, called away={}",
                summary.getTradingDays(), String.format("%.2f", summary.getTotalReturnPct()),
                String.format("%.2f", summary.getSharpeRatio()), String.format("%.2f", summary.getMaxDrawdownPct()),
                String.format("%.2f", summary.getTotalPremiumCollected()), summary.getCallsSold(),
                summary.getCalledAwayCount());

        return BacktestResult.builder()
                .status(BacktestStatus.COMPLETED)
                .config(config)
                .equityCurve(Collections.unmodifiableList(equityCurve))
                .trades(List.copyOf(ledger.getTrades()))
                .summary(summary)
                .cashFloorWarnings(Collections.unmodifiableList(warnings))
                .finalPosition(ledger.getPosition())
                .build();
    }

    /**
     * Runs every configuration against the same series, in order. A configuration
     * that fails yields a {@link BacktestStatus#FAILED} result and does not affect
     * the others.
     */
    public List<BacktestResult> compare(List<StrategyConfig> configs, List<PriceBar> priceSeries) {
        if (configs == null || configs.isEmpty()) {
            throw new InvalidInputException("At least one configuration is required for comparison");
        }

        log.info("Comparing {} configurations over {} bars", configs.size(),
                priceSeries == null ? 0 : priceSeries.size());

        List<BacktestResult> results = new ArrayList<>(configs.size());
        for (StrategyConfig config : configs) {
            results.add(runIsolated(priceSeries, config));
        }

        long failed = results.stream().filter(r -> !r.isCompleted()).count();
        log.info("Comparison complete: {} completed, {} failed", results.size() - failed, failed);
        return results;
    }

    /**
     * Runs one configuration, converting a {@link BacktestException} into a failed result.
     */
    public BacktestResult runIsolated(List<PriceBar> priceSeries, StrategyConfig config) {
        try {
            return run(priceSeries, config);
        } catch (BacktestException e) {
            log.warn("Configuration {} failed: [{}] {}",
                    config != null ? config.getSymbol() + "@" + config.getMinStrike() : "null",
                    e.getErrorCode(), e.getMessage());
            return failed(config, e);
        }
    }

    static BacktestResult failed(StrategyConfig config, BacktestException e) {
        return BacktestResult.builder()
                .status(BacktestStatus.FAILED)
                .config(config)
                .equityCurve(Collections.emptyList())
                .trades(Collections.emptyList())
                .cashFloorWarnings(Collections.emptyList())
                .errorCode(e.getErrorCode().name())
                .errorMessage(e.getMessage())
                .build();
    }

    /**
     * Theoretical value of the open short call, zero when flat.
     */
    static double markToMarket(Position position, PriceBar bar, double volatility,
                               PricingModel pricingModel, StrategyConfig config) {
        if (position == null) {
            return 0.0;
        }
        long daysRemaining = Math.max(position.contract().daysToExpiration(bar.date()), 0);
        double perShare = pricingModel.callPrice(bar.close(), position.strike(),
                daysRemaining / PricingModel.DAYS_PER_YEAR, volatility, config.getRiskFreeRate());
        return perShare * config.getContractMultiplier() * position.contracts();
    }
}
