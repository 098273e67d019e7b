package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.Position;
import com.coveredcall.backtest.dto.PositionStatus;
import com.coveredcall.backtest.dto.PriceBar;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.backtest.dto.StrikeAnalysis;
import com.coveredcall.backtest.optimizer.PremiumOptimizer;
import com.coveredcall.backtest.pricing.PricingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the short-call state machine, driven one day at a time
 * against a fresh ledger.
 */
class PositionEngineTest {

    private static final LocalDate D0 = LocalDate.of(2024, 1, 2);
    private static final double VOL = 0.50;

    /** One strike, no costs, no discretionary rolls. */
    private static StrategyConfig.StrategyConfigBuilder simpleConfig() {
        return StrategyConfig.defaults().toBuilder()
                .strikeCandidates(List.of(2.50))
                .targetDte(30)
                .rollDteThreshold(0)
                .rollProfitCaptureFraction(1.0)
                .bidAskSpreadPct(0.0)
                .commissionPerContract(0.0);
    }

    private static PositionEngine engineFor(StrategyConfig config) {
        PricingModel pricingModel = PricingModel.fromConfig(config);
        return new PositionEngine(config, pricingModel, new PremiumOptimizer(config, pricingModel));
    }

    private static PositionLedger stockedLedger(PositionEngine engine, double price) {
        PositionLedger ledger = new PositionLedger(price * 1000);
        engine.openStockPosition(ledger, PriceBar.of(D0, price));
        return ledger;
    }

    private static double expectedPremium(StrategyConfig config, double spot, double strike, int dte) {
        PricingModel pricingModel = PricingModel.fromConfig(config);
        return pricingModel.callPrice(spot, strike, dte / 365.0, VOL, config.getRiskFreeRate()) * 100 * 10;
    }

    @Nested
    @DisplayName("Opening")
    class Opening {

        @Test
        @DisplayName("Sells a call from flat at the target expiration")
        void opensFromFlat() {
            StrategyConfig config = simpleConfig().build();
            PositionEngine engine = engineFor(config);
            PositionLedger ledger = stockedLedger(engine, 2.0);

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL);

            Position opened = day.opened();
            assertNotNull(opened);
            assertNull(day.outcome());
            assertEquals(2.50, opened.strike());
            assertEquals(D0.plusDays(30), opened.expiration());
            assertEquals(10, opened.contracts());
            assertEquals(expectedPremium(config, 2.0, 2.5, 30), opened.premiumReceived(), 1e-9);
            assertEquals(PositionStatus.OPEN, ledger.getStatus());
            assertEquals(opened.premiumReceived(), ledger.getCash(), 1e-9);
            assertEquals(1, ledger.getCallsSold());
        }

        @Test
        @DisplayName("Holds an open call on a quiet day")
        void holdsOpenCall() {
            PositionEngine engine = engineFor(simpleConfig().build());
            PositionLedger ledger = stockedLedger(engine, 2.0);
            engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL);

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0.plusDays(1), 2.0), VOL);

            assertNull(day.outcome());
            assertNull(day.opened());
            assertEquals(0.0, day.premiumCollected());
            assertEquals(1, ledger.getCallsSold());
        }

        @Test
        @DisplayName("Skips when the net premium is at or below the floor")
        void skipsBelowPremiumFloor() {
            StrategyConfig base = simpleConfig().build();
            double premium = expectedPremium(base, 2.0, 2.5, 30);
            assertTrue(premium > 0 && premium < 50.0, "precondition, premium was " + premium);

            PositionEngine engine = engineFor(base.toBuilder().minNetPremium(50.0).build());
            PositionLedger ledger = stockedLedger(engine, 2.0);

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL);

            assertNull(day.opened());
            assertNotNull(day.skipReason());
            assertEquals(PositionStatus.NONE, ledger.getStatus());
            assertEquals(0, ledger.getCallsSold());
        }

        @Test
        @DisplayName("Never sells a call whose commission exceeds the premium")
        void skipsWhenCostsExceedPremium() {
            PositionEngine engine = engineFor(simpleConfig().commissionPerContract(50.0).build());
            PositionLedger ledger = stockedLedger(engine, 2.0);

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL);

            assertNull(day.opened());
            assertEquals(PositionStatus.NONE, ledger.getStatus());
        }

        @Test
        @DisplayName("Skips when every strike is inside the OTM buffer")
        void skipsWithoutEligibleStrike() {
            PositionEngine engine = engineFor(simpleConfig().build());
            PositionLedger ledger = stockedLedger(engine, 2.49);

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0, 2.49), VOL);

            assertNull(day.opened());
            assertNotNull(day.skipReason());
        }
    }

    @Nested
    @DisplayName("Strike selection")
    class StrikeSelection {

        @Test
        @DisplayName("Without a delta penalty the best return on strike notional wins")
        void prefersIncomeWithoutPenalty() {
            StrategyConfig config = simpleConfig()
                    .strikeCandidates(List.of(3.50, 2.50, 3.00))
                    .deltaPenaltyWeight(0.0)
                    .build();

            PositionEngine.Selection selection = engineFor(config).select(2.0, VOL).orElseThrow();

            assertEquals(2.50, selection.strike());
            assertEquals(30, selection.dte());
        }

        @Test
        @DisplayName("A heavy delta penalty pushes the sale to the farthest strike")
        void heavyPenaltyPrefersLowDelta() {
            StrategyConfig config = simpleConfig()
                    .strikeCandidates(List.of(2.50, 3.00, 3.50))
                    .deltaPenaltyWeight(100.0)
                    .build();

            assertEquals(3.50, engineFor(config).select(2.0, VOL).orElseThrow().strike());
        }

        @Test
        @DisplayName("Several candidate expirations defer to the optimizer's top combo")
        void usesOptimizerForSeveralExpirations() {
            StrategyConfig config = simpleConfig()
                    .strikeCandidates(List.of(2.50, 3.00, 3.50))
                    .candidateDtes(List.of(14, 30, 45))
                    .build();
            PricingModel pricingModel = PricingModel.fromConfig(config);
            StrikeAnalysis top = new PremiumOptimizer(config, pricingModel)
                    .optimize(2.0, config.getStrikeCandidates(), config.getCandidateDtes(), VOL).get(0);

            PositionEngine engine = engineFor(config);
            PositionLedger ledger = stockedLedger(engine, 2.0);
            Position opened = engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL).opened();

            assertNotNull(opened);
            assertEquals(top.strike(), opened.strike());
            assertEquals(D0.plusDays(top.dte()), opened.expiration());
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("Expires worthless below the strike and re-sells the same day")
        void expiresAndReopens() {
            PositionEngine engine = engineFor(simpleConfig().build());
            PositionLedger ledger = stockedLedger(engine, 2.0);
            Position first = engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL).opened();

            LocalDate expiry = D0.plusDays(30);
            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(expiry, 2.0), VOL);

            assertEquals(PositionStatus.EXPIRED_WORTHLESS, day.outcome());
            assertEquals(first.premiumReceived(), day.closedTrade().netPnl(), 1e-12);
            assertNotNull(day.opened());
            assertEquals(expiry.plusDays(30), day.opened().expiration());
            assertEquals(1, ledger.getExpiredWorthlessCount());
            assertEquals(2, ledger.getCallsSold());
            assertEquals(PositionStatus.OPEN, ledger.getStatus());
        }

        @Test
        @DisplayName("Assignment delivers shares at the strike and buys them back at the close")
        void calledAwayWithReacquire() {
            PositionEngine engine = engineFor(simpleConfig().build());
            PositionLedger ledger = stockedLedger(engine, 2.0);
            engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL);
            double cashBefore = ledger.getCash();

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0.plusDays(30), 3.0), VOL);

            assertEquals(PositionStatus.CALLED_AWAY, day.outcome());
            assertEquals(500.0, day.closedTrade().closingCost(), 1e-9);
            assertEquals(1000, ledger.getSharesHeld());
            assertEquals(cashBefore - 500.0, ledger.getCash(), 1e-9);
            assertEquals(1, ledger.getCalledAwayCount());
            // 2.50 is now inside the OTM buffer of a 3.00 stock
            assertNull(day.opened());
            assertEquals(PositionStatus.NONE, ledger.getStatus());
        }

        @Test
        @DisplayName("Without reacquisition the book is left with cash only")
        void calledAwayWithoutReacquire() {
            PositionEngine engine = engineFor(simpleConfig().reacquireSharesOnAssignment(false).build());
            PositionLedger ledger = stockedLedger(engine, 2.0);
            engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL);
            double cashBefore = ledger.getCash();

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0.plusDays(30), 3.0), VOL);

            assertEquals(PositionStatus.CALLED_AWAY, day.outcome());
            assertEquals(0, ledger.getSharesHeld());
            assertEquals(cashBefore + 2500.0, ledger.getCash(), 1e-9);
            assertEquals("No shares to cover a call", day.skipReason());
        }

        @Test
        @DisplayName("Rolls at the DTE threshold into a new contract the same day")
        void rollsIntoNewContract() {
            PositionEngine engine = engineFor(simpleConfig().rollDteThreshold(5).build());
            PositionLedger ledger = stockedLedger(engine, 2.40);
            engine.evaluateDay(ledger, PriceBar.of(D0, 2.40), VOL);

            LocalDate rollDate = D0.plusDays(25);
            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(rollDate, 2.40), VOL);

            assertEquals(PositionStatus.ROLLED, day.outcome());
            assertTrue(day.closingCost() > 0);
            assertNotNull(day.opened());
            assertEquals(rollDate.plusDays(30), day.opened().expiration());
            assertEquals(day.opened().premiumReceived(), day.premiumCollected(), 1e-12);
            assertEquals(1, ledger.getRollCount());
            assertEquals(day.closingCost(), ledger.getBuybackCosts(), 1e-12);
        }

        @Test
        @DisplayName("Defers a roll while no replacement clears the premium floor")
        void defersRollWithoutReplacement() {
            StrategyConfig config = simpleConfig().rollDteThreshold(5).minNetPremium(5.0).build();
            PositionEngine engine = engineFor(config);
            PositionLedger ledger = stockedLedger(engine, 2.0);
            Position first = engine.evaluateDay(ledger, PriceBar.of(D0, 2.0), VOL).opened();
            assertNotNull(first, "precondition: the first sale clears the floor");
            double cashAfterSale = ledger.getCash();

            // At 30% volatility a 30-day 2.50 call is worth well under the 5.00 floor
            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0.plusDays(25), 2.0), 0.30);

            assertNull(day.outcome());
            assertNull(day.closedTrade());
            assertTrue(day.skipReason().startsWith("Roll deferred"), day.skipReason());
            assertEquals(PositionStatus.OPEN, ledger.getStatus());
            assertSame(first, ledger.getPosition());
            assertEquals(0, ledger.getRollCount());
            assertEquals(0.0, ledger.getBuybackCosts());
            assertEquals(cashAfterSale, ledger.getCash(), 1e-12);

            DayEvaluation expiry = engine.evaluateDay(ledger, PriceBar.of(D0.plusDays(30), 2.0), 0.30);
            assertEquals(PositionStatus.EXPIRED_WORTHLESS, expiry.outcome());
        }

        @Test
        @DisplayName("Expiration pre-empts a roll on the same day")
        void expirationBeatsRoll() {
            PositionEngine engine = engineFor(simpleConfig().rollDteThreshold(5).build());
            PositionLedger ledger = stockedLedger(engine, 2.40);
            engine.evaluateDay(ledger, PriceBar.of(D0, 2.40), VOL);

            DayEvaluation day = engine.evaluateDay(ledger, PriceBar.of(D0.plusDays(30), 2.40), VOL);

            assertEquals(PositionStatus.EXPIRED_WORTHLESS, day.outcome());
            assertEquals(0, ledger.getRollCount());
            assertEquals(1, ledger.getTrades().size());
        }
    }
}
