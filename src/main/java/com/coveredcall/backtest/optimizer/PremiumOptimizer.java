package com.coveredcall.backtest.optimizer;

import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.backtest.dto.StrikeAnalysis;
import com.coveredcall.backtest.pricing.PricingModel;
import com.coveredcall.backtest.pricing.TradeSide;
import com.coveredcall.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Grid search over strike x expiration combinations for the best call to sell.
 * <p>
 * Composite score, higher is better:
 * <pre>
 *   0.5 * normalizedIncome + 0.3 * deltaSweetSpotScore + 0.2 * upsideRoomScore
 * </pre>
 * <ul>
 *   <li>normalizedIncome: annualized net premium divided by the best annualized premium in the grid</li>
 *   <li>deltaSweetSpotScore: 1 at the target delta, losing 3 points per unit of delta distance, floored at 0.1</li>
 *   <li>upsideRoomScore: upside to strike over 30%, clamped to [0, 1]</li>
 * </ul>
 * Combos with no positive net premium score zero. Strikes are visited in ascending
 * order and expirations in ascending order; results are sorted by score descending,
 * then lower DTE, then lower strike, so ties are reproducible.
 */
@Slf4j
public class PremiumOptimizer {

    private static final double INCOME_WEIGHT = 0.5;
    private static final double DELTA_WEIGHT = 0.3;
    private static final double UPSIDE_WEIGHT = 0.2;

    private static final double DELTA_DECAY = 3.0;
    private static final double MIN_DELTA_SCORE = 0.1;
    private static final double FULL_UPSIDE = 0.30;

    static final Comparator<StrikeAnalysis> RANKING = Comparator
            .comparingDouble(StrikeAnalysis::score).reversed()
            .thenComparingInt(StrikeAnalysis::dte)
            .thenComparingDouble(StrikeAnalysis::strike);

    private final StrategyConfig config;
    private final PricingModel pricingModel;

    public PremiumOptimizer(StrategyConfig config, PricingModel pricingModel) {
        this.config = config;
        this.pricingModel = pricingModel;
    }

    /**
     * Ranks every eligible (strike, DTE) pair. A strike is eligible when it is at or
     * above the minimum strike and at least {@code minOtmPct} above spot.
     *
     * @return combos sorted best first; empty when no strike is eligible
     */
    public List<StrikeAnalysis> optimize(double spot, List<Double> candidateStrikes,
                                         List<Integer> candidateDtes, double volatility) {
        if (!(spot > 0)) {
            throw new InvalidInputException("Spot must be positive, got " + spot);
        }
        if (candidateStrikes == null || candidateStrikes.isEmpty()) {
            throw new InvalidInputException("At least one candidate strike is required");
        }
        if (candidateDtes == null || candidateDtes.isEmpty()) {
            throw new InvalidInputException("At least one candidate DTE is required");
        }

        List<Double> strikes = candidateStrikes.stream().distinct().sorted().toList();
        List<Integer> dtes = candidateDtes.stream().distinct().sorted().toList();
        double minEligibleStrike = Math.max(config.getMinStrike(), spot * (1.0 + config.getMinOtmPct()));

        List<Pricing> priced = new ArrayList<>();
        double bestAnnualized = 0.0;
        for (double strike : strikes) {
            if (strike < minEligibleStrike) {
                continue;
            }
            for (int dte : dtes) {
                if (dte <= 0) {
                    throw new InvalidInputException("Candidate DTE must be positive, got " + dte);
                }
                Pricing p = price(spot, strike, dte, volatility);
                priced.add(p);
                bestAnnualized = Math.max(bestAnnualized, p.annualizedReturn);
            }
        }

        List<StrikeAnalysis> ranked = new ArrayList<>(priced.size());
        for (Pricing p : priced) {
            ranked.add(score(p, spot, bestAnnualized));
        }
        ranked.sort(RANKING);

        if (log.isDebugEnabled() && !ranked.isEmpty()) {
            StrikeAnalysis top = ranked.get(0);
            log.debug("Optimizer: spot={}, iv={}, {} combos, best strike={} dte={} score={}",
                    spot, volatility, ranked.size(), top.strike(), top.dte(), top.score());
        }
        return ranked;
    }

    /**
     * Ranks the configured strike candidates against the given expirations.
     */
    public List<StrikeAnalysis> optimize(double spot, List<Integer> candidateDtes, double volatility) {
        return optimize(spot, config.getStrikeCandidates(), candidateDtes, volatility);
    }

    private Pricing price(double spot, double strike, int dte, double volatility) {
        double t = dte / PricingModel.DAYS_PER_YEAR;
        double r = config.getRiskFreeRate();

        double mid = pricingModel.callPrice(spot, strike, t, volatility, r);
        double netPerContract = pricingModel.applyCosts(mid, config.getBidAskSpreadPct(),
                config.getCommissionPerContract(), 1, TradeSide.SELL);
        double delta = pricingModel.delta(spot, strike, t, volatility, r);
        double theta = pricingModel.theta(spot, strike, t, volatility, r);
        double notional = spot * pricingModel.getContractMultiplier();
        double annualized = (netPerContract / notional) * (PricingModel.DAYS_PER_YEAR / dte);

        return new Pricing(strike, dte, mid, netPerContract, delta, theta, annualized);
    }

    private StrikeAnalysis score(Pricing p, double spot, double bestAnnualized) {
        double upside = (p.strike - spot) / spot;
        double score = 0.0;
        if (p.netPremium > 0) {
            double income = bestAnnualized > 0 ? p.annualizedReturn / bestAnnualized : 0.0;
            double deltaScore = Math.max(1.0 - Math.abs(p.delta - config.getTargetDelta()) * DELTA_DECAY,
                    MIN_DELTA_SCORE);
            double upsideScore = Math.min(Math.max(upside / FULL_UPSIDE, 0.0), 1.0);
            score = INCOME_WEIGHT * income + DELTA_WEIGHT * deltaScore + UPSIDE_WEIGHT * upsideScore;
        }
        return new StrikeAnalysis(p.strike, p.dte, p.mid, p.netPremium, p.delta, p.theta,
                p.annualizedReturn, upside, score);
    }

    private record Pricing(double strike, int dte, double mid, double netPremium,
                           double delta, double theta, double annualizedReturn) {
    }
}
