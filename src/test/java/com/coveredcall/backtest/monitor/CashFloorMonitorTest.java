package com.coveredcall.backtest.monitor;

import com.coveredcall.backtest.dto.CashFloorAlert;
import com.coveredcall.backtest.dto.CashFloorEstimate;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.exception.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CashFloorMonitor: linear burn, breach detection and alert levels.
 */
class CashFloorMonitorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 2);

    private CashFloorMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = CashFloorMonitor.fromConfig(StrategyConfig.defaults(), START);
    }

    @Nested
    @DisplayName("Burn schedule")
    class BurnSchedule {

        @Test
        @DisplayName("Starts at the configured net cash per share")
        void startsAtInitial() {
            assertEquals(1.50, monitor.netCashAt(START), 1e-12);
        }

        @Test
        @DisplayName("Burns the quarterly amount over 90 calendar days")
        void burnsPerQuarter() {
            assertEquals(1.40, monitor.netCashAt(START.plusDays(90)), 1e-9);
        }

        @Test
        @DisplayName("Never drops below zero")
        void floorsAtZero() {
            assertEquals(0.0, monitor.netCashAt(START.plusDays(5000)), 0.0);
        }

        @Test
        @DisplayName("Depends only on elapsed time, not on sampling order")
        void pureFunctionOfElapsedTime() {
            LocalDate later = START.plusDays(200);
            CashFloorEstimate first = monitor.sample(later, 1.20);
            monitor.sample(START.plusDays(10), 2.00);
            CashFloorEstimate again = monitor.sample(later, 1.20);
            assertEquals(first, again);
        }

        @Test
        @DisplayName("Sampling before the start date is rejected")
        void rejectsDateBeforeStart() {
            assertThrows(InvalidInputException.class, () -> monitor.sample(START.minusDays(1), 1.0));
        }
    }

    @Nested
    @DisplayName("Alert levels")
    class AlertLevels {

        @Test
        @DisplayName("Price near cash raises no alert")
        void noAlertNearCash() {
            CashFloorEstimate estimate = monitor.sample(START, 1.50);
            assertEquals(CashFloorAlert.NONE, estimate.alert());
            assertFalse(estimate.breached());
            assertTrue(estimate.thesisIntact());
            assertNull(estimate.warning());
            assertEquals(1.0, estimate.priceToCashRatio(), 1e-12);
        }

        @Test
        @DisplayName("Price below the warning ratio breaches the floor")
        void belowCash() {
            CashFloorEstimate estimate = monitor.sample(START, 1.00);
            assertEquals(CashFloorAlert.BELOW_CASH, estimate.alert());
            assertTrue(estimate.breached());
            assertTrue(estimate.thesisIntact());
            assertNotNull(estimate.warning());
        }

        @Test
        @DisplayName("Price far above cash warns that downside protection is weak")
        void premiumToCash() {
            CashFloorEstimate estimate = monitor.sample(START, 3.00);
            assertEquals(CashFloorAlert.PREMIUM_TO_CASH, estimate.alert());
            assertFalse(estimate.breached());
        }

        @Test
        @DisplayName("Cash below half the starting estimate raises a burn alert")
        void burnAlert() {
            CashFloorEstimate estimate = monitor.sample(START.plusDays(720), 0.70);
            assertEquals(CashFloorAlert.BURN_ALERT, estimate.alert());
            assertFalse(estimate.thesisIntact());
        }

        @Test
        @DisplayName("Exhausted cash reports an infinite ratio and no breach")
        void exhausted() {
            CashFloorEstimate estimate = monitor.sample(START.plusDays(5000), 1.00);
            assertEquals(CashFloorAlert.CASH_EXHAUSTED, estimate.alert());
            assertEquals(Double.POSITIVE_INFINITY, estimate.priceToCashRatio());
            assertFalse(estimate.breached());
            assertFalse(estimate.thesisIntact());
        }
    }

    @Test
    @DisplayName("Negative parameters are rejected")
    void rejectsNegativeParameters() {
        assertThrows(InvalidInputException.class, () -> new CashFloorMonitor(START, -1.0, 0.0, 0.8, 1.5));
        assertThrows(InvalidInputException.class, () -> new CashFloorMonitor(null, 1.0, 0.0, 0.8, 1.5));
    }
}
