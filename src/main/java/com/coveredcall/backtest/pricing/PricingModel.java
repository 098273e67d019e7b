package com.coveredcall.backtest.pricing;

import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.exception.InsufficientHistoryException;
import com.coveredcall.exception.InvalidInputException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.List;

/**
 * Black-Scholes valuation of European calls, first-order greeks, an implied
 * volatility proxy and the transaction-cost model.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Delta: N(d1)
 *   <li>Theta: [-S * n(d1) * sigma / (2*sqrt(T)) - r * K * e^(-rT) * N(d2)] / 365, per calendar day
 * </ul>
 *
 * <p>Edge cases:
 * <ul>
 *   <li>T = 0 collapses to intrinsic value max(S - K, 0)
 *   <li>sigma = 0 collapses to the discounted forward payoff max(S - K * e^(-rT), 0)
 *   <li>Negative T or sigma, non-positive strike and negative spot are rejected
 * </ul>
 *
 * Instances are immutable and safe to share.
 */
public class PricingModel {

    public static final double DAYS_PER_YEAR = 365.0;
    public static final double TRADING_DAYS_PER_YEAR = 252.0;

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    private final double ivPremiumMultiplier;
    private final double volatilityFloor;
    private final int contractMultiplier;

    public PricingModel(double ivPremiumMultiplier, double volatilityFloor, int contractMultiplier) {
        if (!(ivPremiumMultiplier > 0) || !(volatilityFloor >= 0) || contractMultiplier <= 0) {
            throw new InvalidInputException("Pricing parameters out of range: ivPremiumMultiplier="
                    + ivPremiumMultiplier + ", volatilityFloor=" + volatilityFloor
                    + ", contractMultiplier=" + contractMultiplier);
        }
        this.ivPremiumMultiplier = ivPremiumMultiplier;
        this.volatilityFloor = volatilityFloor;
        this.contractMultiplier = contractMultiplier;
    }

    public static PricingModel fromConfig(StrategyConfig config) {
        return new PricingModel(config.getIvPremiumMultiplier(), config.getVolatilityFloor(),
                config.getContractMultiplier());
    }

    public int getContractMultiplier() {
        return contractMultiplier;
    }

    // ==================== VALUATION ====================

    /**
     * Black-Scholes value of a European call, per share.
     */
    public double callPrice(double spot, double strike, double timeToExpiryYears,
                            double volatility, double riskFreeRate) {
        validate(spot, strike, timeToExpiryYears, volatility, riskFreeRate);

        if (timeToExpiryYears == 0.0) {
            return Math.max(spot - strike, 0.0);
        }
        double discountedStrike = strike * Math.exp(-riskFreeRate * timeToExpiryYears);
        if (volatility == 0.0 || spot == 0.0) {
            return Math.max(spot - discountedStrike, 0.0);
        }

        double sqrtT = Math.sqrt(timeToExpiryYears);
        double d1 = d1(spot, strike, timeToExpiryYears, volatility, riskFreeRate, sqrtT);
        double d2 = d1 - volatility * sqrtT;

        double price = spot * NORM.cumulativeProbability(d1) - discountedStrike * NORM.cumulativeProbability(d2);
        return Math.max(price, 0.0);
    }

    /**
     * Call delta, N(d1). At expiry it is 1 in the money and 0 otherwise.
     */
    public double delta(double spot, double strike, double timeToExpiryYears,
                        double volatility, double riskFreeRate) {
        validate(spot, strike, timeToExpiryYears, volatility, riskFreeRate);

        if (timeToExpiryYears == 0.0) {
            return spot > strike ? 1.0 : 0.0;
        }
        if (volatility == 0.0 || spot == 0.0) {
            return spot > strike * Math.exp(-riskFreeRate * timeToExpiryYears) ? 1.0 : 0.0;
        }
        double sqrtT = Math.sqrt(timeToExpiryYears);
        return NORM.cumulativeProbability(d1(spot, strike, timeToExpiryYears, volatility, riskFreeRate, sqrtT));
    }

    /**
     * Call theta per calendar day, per share. Zero at expiry.
     */
    public double theta(double spot, double strike, double timeToExpiryYears,
                        double volatility, double riskFreeRate) {
        validate(spot, strike, timeToExpiryYears, volatility, riskFreeRate);

        if (timeToExpiryYears == 0.0) {
            return 0.0;
        }
        double expRT = Math.exp(-riskFreeRate * timeToExpiryYears);
        if (volatility == 0.0 || spot == 0.0) {
            // Only the discounting of the strike decays
            return spot > strike * expRT ? -riskFreeRate * strike * expRT / DAYS_PER_YEAR : 0.0;
        }

        double sqrtT = Math.sqrt(timeToExpiryYears);
        double d1 = d1(spot, strike, timeToExpiryYears, volatility, riskFreeRate, sqrtT);
        double d2 = d1 - volatility * sqrtT;

        double theta = -spot * NORM.density(d1) * volatility / (2.0 * sqrtT)
                - riskFreeRate * strike * expRT * NORM.cumulativeProbability(d2);
        return theta / DAYS_PER_YEAR;
    }

    // ==================== VOLATILITY ====================

    /**
     * Implied volatility proxy: annualized standard deviation of the trailing
     * {@code windowDays} daily log returns, scaled by the IV premium multiplier
     * and floored at the configured minimum.
     *
     * @param priceHistory closes in chronological order, the last entry being the current day
     * @param windowDays   number of trailing returns; needs windowDays prior bars
     * @throws InsufficientHistoryException if fewer than windowDays prior bars exist
     */
    public double estimateVolatility(List<Double> priceHistory, int windowDays) {
        if (windowDays < 2) {
            throw new InvalidInputException("Volatility window must be at least 2 days, got " + windowDays);
        }
        int available = priceHistory == null ? 0 : priceHistory.size();
        if (available < windowDays + 1) {
            throw new InsufficientHistoryException(windowDays + 1, available);
        }

        double[] logReturns = new double[windowDays];
        int start = available - windowDays - 1;
        for (int i = 0; i < windowDays; i++) {
            double previous = priceHistory.get(start + i);
            double current = priceHistory.get(start + i + 1);
            if (!(previous > 0) || !(current > 0)) {
                throw new InvalidInputException("Prices must be positive for volatility estimation");
            }
            logReturns[i] = Math.log(current / previous);
        }

        // Population standard deviation over the window
        double historical = new StandardDeviation(false).evaluate(logReturns) * Math.sqrt(TRADING_DAYS_PER_YEAR);
        return Math.max(historical * ivPremiumMultiplier, volatilityFloor);
    }

    // ==================== COSTS ====================

    /**
     * Cash that changes hands when {@code contracts} calls trade at {@code midPrice}.
     * <ul>
     *   <li>SELL: mid * (1 - spread/2) * multiplier * contracts - commission * contracts (received)
     *   <li>BUY: mid * (1 + spread/2) * multiplier * contracts + commission * contracts (paid)
     * </ul>
     *
     * @param spreadPct full bid-ask spread as a fraction of mid, in [0, 1]
     */
    public double applyCosts(double midPrice, double spreadPct, double commissionPerContract,
                             int contracts, TradeSide side) {
        if (!(midPrice >= 0) || Double.isInfinite(midPrice)) {
            throw new InvalidInputException("Mid price must be a finite non-negative number, got " + midPrice);
        }
        if (!(spreadPct >= 0 && spreadPct <= 1)) {
            throw new InvalidInputException("Spread must be in [0, 1], got " + spreadPct);
        }
        if (!(commissionPerContract >= 0)) {
            throw new InvalidInputException("Commission must be non-negative, got " + commissionPerContract);
        }
        if (contracts < 0) {
            throw new InvalidInputException("Contracts must be non-negative, got " + contracts);
        }

        double commission = commissionPerContract * contracts;
        if (side == TradeSide.SELL) {
            return midPrice * (1.0 - spreadPct / 2.0) * contractMultiplier * contracts - commission;
        }
        return midPrice * (1.0 + spreadPct / 2.0) * contractMultiplier * contracts + commission;
    }

    // ==================== INTERNALS ====================

    private static double d1(double spot, double strike, double t, double volatility, double r, double sqrtT) {
        return (Math.log(spot / strike) + (r + volatility * volatility / 2.0) * t) / (volatility * sqrtT);
    }

    private static void validate(double spot, double strike, double t, double volatility, double r) {
        if (!(t >= 0) || Double.isInfinite(t)) {
            throw new InvalidInputException("Time to expiry must be a finite non-negative number, got " + t);
        }
        if (!(volatility >= 0) || Double.isInfinite(volatility)) {
            throw new InvalidInputException("Volatility must be a finite non-negative number, got " + volatility);
        }
        if (!(spot >= 0) || Double.isInfinite(spot)) {
            throw new InvalidInputException("Spot must be a finite non-negative number, got " + spot);
        }
        if (!(strike > 0) || Double.isInfinite(strike)) {
            throw new InvalidInputException("Strike must be a finite positive number, got " + strike);
        }
        if (Double.isNaN(r) || Double.isInfinite(r)) {
            throw new InvalidInputException("Risk-free rate must be finite, got " + r);
        }
    }
}
