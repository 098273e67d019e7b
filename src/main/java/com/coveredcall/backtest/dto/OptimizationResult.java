package com.coveredcall.backtest.dto;

import java.util.List;

/**
 * Ranked strike/expiration combos for one spot price.
 *
 * @param volatility the volatility the combos were priced at, given or estimated
 */
public record OptimizationResult(double spot, double volatility, List<StrikeAnalysis> rankings) {
}
