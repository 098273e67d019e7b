package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.exception.InvalidInputException;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Range checks on a {@link StrategyConfig}, run once before a backtest starts.
 */
@UtilityClass
public class StrategyConfigValidator {

    public static void validate(StrategyConfig config) {
        if (config == null) {
            throw new InvalidInputException("Strategy config is required");
        }

        requireThat(config.getContractMultiplier() > 0,
                "contractMultiplier must be positive, got " + config.getContractMultiplier());
        requireThat(config.getShares() >= config.getContractMultiplier(),
                "shares (" + config.getShares() + ") must cover at least one contract of "
                        + config.getContractMultiplier());

        validateStrikes(config.getStrikeCandidates());
        requireNonNegative("minStrike", config.getMinStrike());
        requireNonNegative("minOtmPct", config.getMinOtmPct());
        requireNonNegative("minNetPremium", config.getMinNetPremium());
        requireNonNegative("deltaPenaltyWeight", config.getDeltaPenaltyWeight());
        requireThat(config.getTargetDelta() >= 0 && config.getTargetDelta() <= 1,
                "targetDelta must be in [0, 1], got " + config.getTargetDelta());

        requireThat(config.getTargetDte() > 0, "targetDte must be positive, got " + config.getTargetDte());
        List<Integer> dtes = config.getCandidateDtes();
        requireThat(dtes != null && !dtes.isEmpty(), "candidateDtes must not be empty");
        for (Integer dte : dtes) {
            requireThat(dte != null && dte > 0, "candidateDtes must be positive, got " + dte);
        }
        requireThat(config.getRollDteThreshold() >= 0 && config.getRollDteThreshold() < config.getTargetDte(),
                "rollDteThreshold must be in [0, targetDte), got " + config.getRollDteThreshold());
        if (config.usesOptimizer()) {
            for (Integer dte : dtes) {
                requireThat(dte > config.getRollDteThreshold(), "candidateDtes must exceed rollDteThreshold ("
                        + config.getRollDteThreshold() + "), got " + dte);
            }
        }
        requireFraction("rollProfitCaptureFraction", config.getRollProfitCaptureFraction());

        requireFraction("bidAskSpreadPct", config.getBidAskSpreadPct());
        requireNonNegative("commissionPerContract", config.getCommissionPerContract());

        requireThat(Double.isFinite(config.getRiskFreeRate()),
                "riskFreeRate must be finite, got " + config.getRiskFreeRate());
        requireThat(config.getIvPremiumMultiplier() > 0 && Double.isFinite(config.getIvPremiumMultiplier()),
                "ivPremiumMultiplier must be positive, got " + config.getIvPremiumMultiplier());
        requireThat(config.getVolatilityWindowDays() >= 2,
                "volatilityWindowDays must be at least 2, got " + config.getVolatilityWindowDays());
        requireThat(config.getDefaultVolatility() > 0 && Double.isFinite(config.getDefaultVolatility()),
                "defaultVolatility must be positive, got " + config.getDefaultVolatility());
        requireNonNegative("volatilityFloor", config.getVolatilityFloor());

        requireNonNegative("netCashPerShare", config.getNetCashPerShare());
        requireNonNegative("cashBurnPerQuarter", config.getCashBurnPerQuarter());
        requireNonNegative("cashFloorWarningThreshold", config.getCashFloorWarningThreshold());
        requireNonNegative("cashPremiumWarningRatio", config.getCashPremiumWarningRatio());

        requireThat(config.getMaxCalendarGapDays() >= 1,
                "maxCalendarGapDays must be at least 1, got " + config.getMaxCalendarGapDays());
    }

    private static void validateStrikes(List<Double> strikes) {
        requireThat(strikes != null && !strikes.isEmpty(), "strikeCandidates must not be empty");
        for (Double strike : strikes) {
            requireThat(strike != null && strike > 0 && Double.isFinite(strike),
                    "strikeCandidates must be positive, got " + strike);
        }
    }

    private static void requireNonNegative(String field, double value) {
        requireThat(value >= 0 && Double.isFinite(value), field + " must be non-negative, got " + value);
    }

    private static void requireFraction(String field, double value) {
        requireThat(value >= 0 && value <= 1, field + " must be in [0, 1], got " + value);
    }

    private static void requireThat(boolean condition, String message) {
        if (!condition) {
            throw new InvalidInputException(message);
        }
    }
}
