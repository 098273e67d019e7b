package com.coveredcall.backtest.pricing;

import com.coveredcall.exception.InsufficientHistoryException;
import com.coveredcall.exception.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PricingModel. Black-Scholes outputs are checked against
 * textbook reference values (S=100, K=100, T=1, sigma=20%, r=5%).
 */
class PricingModelTest {

    private static final double TOLERANCE = 1e-3;

    private PricingModel pricingModel;

    @BeforeEach
    void setUp() {
        pricingModel = new PricingModel(1.0, 0.0, 100);
    }

    @Nested
    @DisplayName("Call valuation")
    class CallValuation {

        @Test
        @DisplayName("ATM one-year call matches the reference price")
        void atmReferencePrice() {
            double price = pricingModel.callPrice(100, 100, 1.0, 0.20, 0.05);
            assertEquals(10.4506, price, TOLERANCE);
        }

        @Test
        @DisplayName("Zero time to expiry collapses to intrinsic value")
        void zeroTimeIsIntrinsic() {
            assertEquals(5.0, pricingModel.callPrice(105, 100, 0.0, 0.30, 0.05), 1e-12);
            assertEquals(0.0, pricingModel.callPrice(95, 100, 0.0, 0.30, 0.05), 1e-12);
        }

        @Test
        @DisplayName("Zero volatility collapses to the discounted forward payoff")
        void zeroVolatility() {
            double expected = 105 - 100 * Math.exp(-0.05 * 0.5);
            assertEquals(expected, pricingModel.callPrice(105, 100, 0.5, 0.0, 0.05), 1e-9);
            assertEquals(0.0, pricingModel.callPrice(90, 100, 0.5, 0.0, 0.05), 1e-12);
        }

        @Test
        @DisplayName("Price is never negative and rises with volatility")
        void monotoneInVolatility() {
            double low = pricingModel.callPrice(2.0, 2.5, 30 / 365.0, 0.30, 0.045);
            double high = pricingModel.callPrice(2.0, 2.5, 30 / 365.0, 0.80, 0.045);
            assertTrue(low >= 0.0);
            assertTrue(high > low);
        }

        @Test
        @DisplayName("Price never decreases as time to expiry grows")
        void monotoneInTime() {
            for (double[] spotStrike : new double[][]{{2.0, 2.5}, {2.5, 2.5}, {3.0, 2.5}}) {
                double previous = pricingModel.callPrice(spotStrike[0], spotStrike[1], 0.0, 0.50, 0.045);
                for (int days = 1; days <= 730; days++) {
                    double price = pricingModel.callPrice(spotStrike[0], spotStrike[1], days / 365.0, 0.50, 0.045);
                    assertTrue(price >= previous - 1e-12,
                            "spot " + spotStrike[0] + " day " + days + ": " + price + " < " + previous);
                    previous = price;
                }
            }
        }

        @Test
        @DisplayName("Price never decreases as volatility grows")
        void monotoneInVolatilitySweep() {
            for (double[] spotStrike : new double[][]{{2.0, 2.5}, {2.5, 2.5}, {3.0, 2.5}}) {
                double previous = pricingModel.callPrice(spotStrike[0], spotStrike[1], 30 / 365.0, 0.0, 0.045);
                for (int step = 1; step <= 300; step++) {
                    double volatility = step * 0.01;
                    double price = pricingModel.callPrice(spotStrike[0], spotStrike[1], 30 / 365.0, volatility, 0.045);
                    assertTrue(price >= previous - 1e-12,
                            "spot " + spotStrike[0] + " vol " + volatility + ": " + price + " < " + previous);
                    previous = price;
                }
            }
        }

        @Test
        @DisplayName("Negative time or volatility is rejected")
        void rejectsNegativeInputs() {
            assertThrows(InvalidInputException.class, () -> pricingModel.callPrice(100, 100, -0.1, 0.2, 0.05));
            assertThrows(InvalidInputException.class, () -> pricingModel.callPrice(100, 100, 1.0, -0.2, 0.05));
            assertThrows(InvalidInputException.class, () -> pricingModel.callPrice(100, 0, 1.0, 0.2, 0.05));
        }
    }

    @Nested
    @DisplayName("Greeks")
    class Greeks {

        @Test
        @DisplayName("ATM delta matches N(d1)")
        void atmDelta() {
            assertEquals(0.6368, pricingModel.delta(100, 100, 1.0, 0.20, 0.05), TOLERANCE);
        }

        @Test
        @DisplayName("Delta at expiry is 1 in the money and 0 out of the money")
        void deltaAtExpiry() {
            assertEquals(1.0, pricingModel.delta(110, 100, 0.0, 0.2, 0.05));
            assertEquals(0.0, pricingModel.delta(90, 100, 0.0, 0.2, 0.05));
        }

        @Test
        @DisplayName("Theta is negative and quoted per calendar day")
        void thetaPerDay() {
            double theta = pricingModel.theta(100, 100, 1.0, 0.20, 0.05);
            assertEquals(-6.414 / 365.0, theta, 1e-4);
        }

        @Test
        @DisplayName("Deep OTM delta is near zero")
        void deepOtmDelta() {
            double delta = pricingModel.delta(2.0, 5.0, 30 / 365.0, 0.50, 0.045);
            assertTrue(delta >= 0.0 && delta < 0.01, "got " + delta);
        }
    }

    @Nested
    @DisplayName("Volatility estimate")
    class VolatilityEstimate {

        @Test
        @DisplayName("Alternating closes give the annualized population standard deviation")
        void alternatingCloses() {
            List<Double> closes = List.of(100.0, 110.0, 100.0, 110.0, 100.0);
            double expected = Math.log(1.1) * Math.sqrt(252);
            assertEquals(expected, pricingModel.estimateVolatility(closes, 4), 1e-9);
        }

        @Test
        @DisplayName("Only the trailing window is used")
        void trailingWindowOnly() {
            List<Double> closes = new ArrayList<>(List.of(50.0, 80.0, 30.0));
            closes.addAll(Collections.nCopies(5, 10.0));
            // Last 4 returns are all zero
            assertEquals(0.0, pricingModel.estimateVolatility(closes, 4), 1e-12);
        }

        @Test
        @DisplayName("IV multiplier scales and the floor bounds the estimate")
        void multiplierAndFloor() {
            PricingModel scaled = new PricingModel(1.3, 0.30, 100);
            List<Double> alternating = List.of(100.0, 110.0, 100.0);
            assertEquals(Math.log(1.1) * Math.sqrt(252) * 1.3, scaled.estimateVolatility(alternating, 2), 1e-9);

            List<Double> flat = Collections.nCopies(21, 2.0);
            assertEquals(0.30, scaled.estimateVolatility(flat, 20), 1e-12);
        }

        @Test
        @DisplayName("Too few bars raises InsufficientHistoryException")
        void insufficientHistory() {
            InsufficientHistoryException e = assertThrows(InsufficientHistoryException.class,
                    () -> pricingModel.estimateVolatility(Collections.nCopies(20, 2.0), 20));
            assertEquals(21, e.getRequiredBars());
            assertEquals(20, e.getAvailableBars());
        }

        @Test
        @DisplayName("Window below two is rejected")
        void windowTooSmall() {
            assertThrows(InvalidInputException.class,
                    () -> pricingModel.estimateVolatility(List.of(1.0, 2.0, 3.0), 1));
        }
    }

    @Nested
    @DisplayName("Transaction costs")
    class TransactionCosts {

        @Test
        @DisplayName("Selling receives mid less half the spread, less commission")
        void sellSide() {
            assertEquals(17.70, pricingModel.applyCosts(0.10, 0.10, 0.65, 2, TradeSide.SELL), 1e-9);
        }

        @Test
        @DisplayName("Buying pays mid plus half the spread, plus commission")
        void buySide() {
            assertEquals(22.30, pricingModel.applyCosts(0.10, 0.10, 0.65, 2, TradeSide.BUY), 1e-9);
        }

        @Test
        @DisplayName("Buying back always costs more than selling receives")
        void asymmetric() {
            double sell = pricingModel.applyCosts(0.25, 0.15, 0.65, 10, TradeSide.SELL);
            double buy = pricingModel.applyCosts(0.25, 0.15, 0.65, 10, TradeSide.BUY);
            assertTrue(buy > sell);
        }

        @Test
        @DisplayName("Out-of-range spread is rejected")
        void rejectsBadSpread() {
            assertThrows(InvalidInputException.class,
                    () -> pricingModel.applyCosts(0.10, 1.5, 0.65, 1, TradeSide.SELL));
        }
    }
}
