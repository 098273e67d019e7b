package com.coveredcall.backtest.dto;

import java.time.LocalDate;

/**
 * End-of-day snapshot. A run produces exactly one per price bar.
 *
 * @param optionLiability  mark-to-market value of the open short call, zero when flat
 * @param premiumCollected net sale premium received this day
 * @param outcome          terminal outcome resolved this day, or null
 */
public record EquityCurveSample(
        LocalDate date,
        double underlyingPrice,
        double volatility,
        int sharesHeld,
        double cash,
        double optionLiability,
        double premiumCollected,
        double equity,
        PositionStatus positionStatus,
        PositionStatus outcome,
        double netCashPerShare,
        boolean cashFloorBreached
) {
}
