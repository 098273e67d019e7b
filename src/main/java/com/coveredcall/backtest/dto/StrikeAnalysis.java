package com.coveredcall.backtest.dto;

/**
 * One strike/expiration combination scored by the premium optimizer.
 *
 * @param theoreticalPremium mid price per share
 * @param netPremium         premium per contract after sell-side spread and commission
 * @param thetaDaily         per-calendar-day theta per share
 * @param annualizedReturn   net premium over the underlying notional, annualized
 * @param upsideToStrike     (strike - spot) / spot
 */
public record StrikeAnalysis(
        double strike,
        int dte,
        double theoreticalPremium,
        double netPremium,
        double delta,
        double thetaDaily,
        double annualizedReturn,
        double upsideToStrike,
        double score
) {
}
