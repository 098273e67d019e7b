package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.BacktestSummary;
import com.coveredcall.backtest.dto.EquityCurveSample;
import com.coveredcall.backtest.pricing.PricingModel;
import lombok.experimental.UtilityClass;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Summary statistics over a finished equity curve and ledger.
 * <p>
 * Returns are in percent. Sharpe uses daily equity returns with a zero risk-free
 * rate and population standard deviation, annualized by sqrt(252); it is zero when
 * fewer than two returns exist or the returns have no dispersion.
 */
@UtilityClass
public class PerformanceCalculator {

    public static BacktestSummary summarize(List<EquityCurveSample> curve, PositionLedger ledger,
                                            double initialEquity) {
        int tradingDays = curve.size();
        double finalEquity = tradingDays > 0 ? curve.get(tradingDays - 1).equity() : initialEquity;

        double totalReturnPct = initialEquity > 0 ? (finalEquity / initialEquity - 1.0) * 100.0 : 0.0;
        double stockOnlyReturnPct = tradingDays > 0
                ? (curve.get(tradingDays - 1).underlyingPrice() / curve.get(0).underlyingPrice() - 1.0) * 100.0
                : 0.0;

        double netPremium = ledger.getPremiumCollected() - ledger.getBuybackCosts();
        double premiumYieldPct = initialEquity > 0 ? ledger.getPremiumCollected() / initialEquity * 100.0 : 0.0;

        double[] drawdown = maxDrawdown(curve);
        int breachDays = (int) curve.stream().filter(EquityCurveSample::cashFloorBreached).count();

        return BacktestSummary.builder()
                .tradingDays(tradingDays)
                .initialEquity(initialEquity)
                .finalEquity(finalEquity)
                .totalReturnPct(totalReturnPct)
                .annualizedReturnPct(annualizedReturnPct(initialEquity, finalEquity, tradingDays))
                .stockOnlyReturnPct(stockOnlyReturnPct)
                .excessReturnPct(totalReturnPct - stockOnlyReturnPct)
                .totalPremiumCollected(ledger.getPremiumCollected())
                .totalBuybackCost(ledger.getBuybackCosts())
                .totalCommissions(ledger.getCommissionsPaid())
                .netPremium(netPremium)
                .premiumYieldPct(premiumYieldPct)
                .sharpeRatio(sharpeRatio(curve))
                .maxDrawdownPct(drawdown[0])
                .maxDrawdownAmount(drawdown[1])
                .tradeCount(ledger.getTrades().size())
                .callsSold(ledger.getCallsSold())
                .calledAwayCount(ledger.getCalledAwayCount())
                .expiredWorthlessCount(ledger.getExpiredWorthlessCount())
                .rollCount(ledger.getRollCount())
                .avgDaysPerCycle(averageDaysBetween(ledger.getSaleDates()))
                .cashFloorBreachDays(breachDays)
                .build();
    }

    /**
     * Compounded return scaled to 252 trading days.
     */
    static double annualizedReturnPct(double initialEquity, double finalEquity, int tradingDays) {
        if (tradingDays <= 0 || initialEquity <= 0) {
            return 0.0;
        }
        double growth = finalEquity / initialEquity;
        if (growth <= 0) {
            return -100.0;
        }
        return (Math.pow(growth, PricingModel.TRADING_DAYS_PER_YEAR / tradingDays) - 1.0) * 100.0;
    }

    static double sharpeRatio(List<EquityCurveSample> curve) {
        if (curve.size() < 3) {
            return 0.0;
        }
        double[] returns = new double[curve.size() - 1];
        for (int i = 1; i < curve.size(); i++) {
            double previous = curve.get(i - 1).equity();
            returns[i - 1] = previous != 0 ? curve.get(i).equity() / previous - 1.0 : 0.0;
        }
        double std = new StandardDeviation(false).evaluate(returns);
        if (!(std > 0)) {
            return 0.0;
        }
        return new Mean().evaluate(returns) / std * Math.sqrt(PricingModel.TRADING_DAYS_PER_YEAR);
    }

    /**
     * @return {percent of peak, amount}, both non-negative
     */
    static double[] maxDrawdown(List<EquityCurveSample> curve) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxPct = 0.0;
        double maxAmount = 0.0;
        for (EquityCurveSample sample : curve) {
            double equity = sample.equity();
            if (equity > peak) {
                peak = equity;
            }
            double amount = peak - equity;
            if (amount > maxAmount) {
                maxAmount = amount;
            }
            if (peak > 0) {
                maxPct = Math.max(maxPct, amount / peak * 100.0);
            }
        }
        return new double[]{maxPct, maxAmount};
    }

    static double averageDaysBetween(List<LocalDate> dates) {
        if (dates.size() < 2) {
            return 0.0;
        }
        long total = ChronoUnit.DAYS.between(dates.get(0), dates.get(dates.size() - 1));
        return (double) total / (dates.size() - 1);
    }
}
