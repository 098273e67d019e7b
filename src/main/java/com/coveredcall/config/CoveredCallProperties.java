package com.coveredcall.config;

import com.coveredcall.backtest.dto.StrategyConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Covered Call Backtester Configuration
 *
 * Application-wide strategy defaults, used whenever a request does not supply its
 * own configuration, plus switches for the service layer.
 *
 * Thread-safety: immutable after Spring initialization. {@link #toStrategyConfig()}
 * returns a fresh immutable snapshot on every call.
 */
@Configuration
@ConfigurationProperties(prefix = "covered-call")
@Data
public class CoveredCallProperties {

    /**
     * Default strategy parameters.
     */
    private Strategy strategy = new Strategy();

    /**
     * Service-layer settings.
     */
    private Backtest backtest = new Backtest();

    /**
     * Expirations ranked by the standalone optimizer endpoint when a request names none.
     * Default: 14, 21, 30, 45
     */
    private List<Integer> optimizerDtes = new ArrayList<>(List.of(14, 21, 30, 45));

    @Data
    public static class Backtest {

        /**
         * Master switch for the backtest endpoints.
         * Default: true
         */
        private boolean enabled = true;

        /**
         * Thread pool size for configuration comparison sweeps.
         * Default: 4
         */
        private int comparePoolSize = 4;

        /**
         * Maximum number of results kept for lookup by id.
         * Default: 100
         */
        private int maxCacheSize = 100;
    }

    @Data
    public static class Strategy {
        private String symbol = "NXDR";
        private int shares = 1000;
        private int contractMultiplier = 100;
        private double minStrike = 2.50;
        private List<Double> strikeCandidates = new ArrayList<>(List.of(2.00, 2.50, 3.00, 3.50, 4.00, 5.00));
        private int targetDte = 30;
        private List<Integer> candidateDtes = new ArrayList<>(List.of(30));
        private double deltaPenaltyWeight = 0.5;
        private double targetDelta = 0.20;
        private double minOtmPct = 0.02;
        private double minNetPremium = 0.0;
        private int rollDteThreshold = 5;
        private double rollProfitCaptureFraction = 0.80;
        private double bidAskSpreadPct = 0.15;
        private double commissionPerContract = 0.65;
        private double riskFreeRate = 0.045;
        private double ivPremiumMultiplier = 1.3;
        private int volatilityWindowDays = 20;
        private double defaultVolatility = 0.50;
        private double volatilityFloor = 0.30;
        private double netCashPerShare = 1.50;
        private double cashBurnPerQuarter = 0.10;
        private double cashFloorWarningThreshold = 0.80;
        private double cashPremiumWarningRatio = 1.5;
        private boolean reacquireSharesOnAssignment = true;
        private int maxCalendarGapDays = 7;
    }

    public StrategyConfig toStrategyConfig() {
        return StrategyConfig.builder()
                .symbol(strategy.getSymbol())
                .shares(strategy.getShares())
                .contractMultiplier(strategy.getContractMultiplier())
                .minStrike(strategy.getMinStrike())
                .strikeCandidates(List.copyOf(strategy.getStrikeCandidates()))
                .targetDte(strategy.getTargetDte())
                .candidateDtes(List.copyOf(strategy.getCandidateDtes()))
                .deltaPenaltyWeight(strategy.getDeltaPenaltyWeight())
                .targetDelta(strategy.getTargetDelta())
                .minOtmPct(strategy.getMinOtmPct())
                .minNetPremium(strategy.getMinNetPremium())
                .rollDteThreshold(strategy.getRollDteThreshold())
                .rollProfitCaptureFraction(strategy.getRollProfitCaptureFraction())
                .bidAskSpreadPct(strategy.getBidAskSpreadPct())
                .commissionPerContract(strategy.getCommissionPerContract())
                .riskFreeRate(strategy.getRiskFreeRate())
                .ivPremiumMultiplier(strategy.getIvPremiumMultiplier())
                .volatilityWindowDays(strategy.getVolatilityWindowDays())
                .defaultVolatility(strategy.getDefaultVolatility())
                .volatilityFloor(strategy.getVolatilityFloor())
                .netCashPerShare(strategy.getNetCashPerShare())
                .cashBurnPerQuarter(strategy.getCashBurnPerQuarter())
                .cashFloorWarningThreshold(strategy.getCashFloorWarningThreshold())
                .cashPremiumWarningRatio(strategy.getCashPremiumWarningRatio())
                .reacquireSharesOnAssignment(strategy.isReacquireSharesOnAssignment())
                .maxCalendarGapDays(strategy.getMaxCalendarGapDays())
                .build();
    }
}
