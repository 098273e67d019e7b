package com.coveredcall.backtest.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Immutable strategy configuration for one backtest run.
 * <p>
 * Defaults describe a 1000-share position in a small-cap trading near its net cash
 * value, selling roughly monthly calls. Ranges are checked once at run start by
 * {@link com.coveredcall.backtest.engine.StrategyConfigValidator}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class StrategyConfig {

    @Builder.Default
    String symbol = "NXDR";

    /** Shares held against the calls. Contracts sold = shares / contractMultiplier. */
    @Builder.Default
    int shares = 1000;

    @Builder.Default
    int contractMultiplier = 100;

    // ==================== STRIKE / EXPIRATION SELECTION ====================

    @Builder.Default
    double minStrike = 2.50;

    /** Candidate strikes. Iterated in ascending order regardless of input order. */
    @Builder.Default
    List<Double> strikeCandidates = List.of(2.00, 2.50, 3.00, 3.50, 4.00, 5.00);

    /** Calendar days to expiration for each new sale. */
    @Builder.Default
    int targetDte = 30;

    /**
     * Candidate expirations. With more than one entry the premium optimizer picks
     * strike and expiration together.
     */
    @Builder.Default
    List<Integer> candidateDtes = List.of(30);

    /** Weight of delta (assignment probability) subtracted from annualized return. */
    @Builder.Default
    double deltaPenaltyWeight = 0.5;

    /** Delta at which the optimizer's sweet-spot score peaks. */
    @Builder.Default
    double targetDelta = 0.20;

    /** Strikes below spot * (1 + minOtmPct) are not sold. */
    @Builder.Default
    double minOtmPct = 0.02;

    /** Total net premium per sale at or below which no call is sold. */
    @Builder.Default
    double minNetPremium = 0.0;

    // ==================== ROLL ====================

    @Builder.Default
    int rollDteThreshold = 5;

    /** Roll once this fraction of the original premium has been captured. */
    @Builder.Default
    double rollProfitCaptureFraction = 0.80;

    // ==================== COSTS ====================

    /** Full bid-ask spread as a fraction of mid; each side pays half. */
    @Builder.Default
    double bidAskSpreadPct = 0.15;

    @Builder.Default
    double commissionPerContract = 0.65;

    // ==================== PRICING ====================

    @Builder.Default
    double riskFreeRate = 0.045;

    /** Implied over historical volatility multiplier. */
    @Builder.Default
    double ivPremiumMultiplier = 1.3;

    @Builder.Default
    int volatilityWindowDays = 20;

    /** Volatility used until the trailing window is filled. */
    @Builder.Default
    double defaultVolatility = 0.50;

    @Builder.Default
    double volatilityFloor = 0.30;

    // ==================== CASH FLOOR ====================

    @Builder.Default
    double netCashPerShare = 1.50;

    @Builder.Default
    double cashBurnPerQuarter = 0.10;

    /** Breach when price / cash floor drops below this ratio. */
    @Builder.Default
    double cashFloorWarningThreshold = 0.80;

    /** Advisory warning when price / cash floor rises above this ratio. */
    @Builder.Default
    double cashPremiumWarningRatio = 1.5;

    // ==================== LIFECYCLE / DATA ====================

    /** Buy the shares back at the close after an assignment so selling can resume. */
    @Builder.Default
    boolean reacquireSharesOnAssignment = true;

    /** Largest calendar gap between consecutive bars treated as non-trading days. */
    @Builder.Default
    int maxCalendarGapDays = 7;

    public static StrategyConfig defaults() {
        return StrategyConfig.builder().build();
    }

    public boolean usesOptimizer() {
        return candidateDtes != null && candidateDtes.size() > 1;
    }
}
