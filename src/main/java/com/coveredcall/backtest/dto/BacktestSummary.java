package com.coveredcall.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated performance statistics of one run.
 * Percentages are expressed in percent (12.5 = 12.5%).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestSummary {

    private int tradingDays;

    private double initialEquity;
    private double finalEquity;

    // Returns
    private double totalReturnPct;
    private double annualizedReturnPct;
    /** Buy-and-hold return of the underlying over the same bars. */
    private double stockOnlyReturnPct;
    private double excessReturnPct;

    // Premium income
    private double totalPremiumCollected;
    private double totalBuybackCost;
    private double totalCommissions;
    /** Premium collected minus buy-back cost. */
    private double netPremium;
    private double premiumYieldPct;

    // Risk
    /** Daily-return Sharpe ratio annualized by sqrt(252), zero risk-free rate. */
    private double sharpeRatio;
    /** Largest peak-to-trough decline, as a positive percentage of the peak. */
    private double maxDrawdownPct;
    private double maxDrawdownAmount;

    // Activity
    private int tradeCount;
    private int callsSold;
    private int calledAwayCount;
    private int expiredWorthlessCount;
    private int rollCount;
    private double avgDaysPerCycle;
    private int cashFloorBreachDays;
}
