package com.coveredcall.backtest.monitor;

import com.coveredcall.backtest.dto.CashFloorAlert;
import com.coveredcall.backtest.dto.CashFloorEstimate;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.exception.InvalidInputException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Tracks the "trades near net cash" thesis.
 * <p>
 * Net cash per share starts at a configured estimate and burns linearly per
 * calendar day, never below zero. Each {@link #sample} is a pure function of
 * the elapsed days since the start date and the day's price, so any date can
 * be sampled without replaying history.
 * <p>
 * Advisory only: a breach never forces a position change.
 */
public class CashFloorMonitor {

    public static final double DAYS_PER_QUARTER = 90.0;

    /** Cash below this fraction of the starting estimate raises a burn alert. */
    private static final double BURN_ALERT_FRACTION = 0.5;

    private final LocalDate startDate;
    private final double initialNetCashPerShare;
    private final double dailyBurnPerShare;
    private final double warningThreshold;
    private final double premiumWarningRatio;

    public CashFloorMonitor(LocalDate startDate, double initialNetCashPerShare, double dailyBurnPerShare,
                            double warningThreshold, double premiumWarningRatio) {
        if (startDate == null) {
            throw new InvalidInputException("Cash floor start date is required");
        }
        if (!(initialNetCashPerShare >= 0) || !(dailyBurnPerShare >= 0)
                || !(warningThreshold >= 0) || !(premiumWarningRatio >= 0)) {
            throw new InvalidInputException("Cash floor parameters must be non-negative");
        }
        this.startDate = startDate;
        this.initialNetCashPerShare = initialNetCashPerShare;
        this.dailyBurnPerShare = dailyBurnPerShare;
        this.warningThreshold = warningThreshold;
        this.premiumWarningRatio = premiumWarningRatio;
    }

    public static CashFloorMonitor fromConfig(StrategyConfig config, LocalDate startDate) {
        return new CashFloorMonitor(startDate,
                config.getNetCashPerShare(),
                config.getCashBurnPerQuarter() / DAYS_PER_QUARTER,
                config.getCashFloorWarningThreshold(),
                config.getCashPremiumWarningRatio());
    }

    /**
     * Estimated net cash per share on {@code date}.
     */
    public double netCashAt(LocalDate date) {
        long elapsedDays = ChronoUnit.DAYS.between(startDate, date);
        if (elapsedDays < 0) {
            throw new InvalidInputException("Cash floor sampled on " + date + ", before start " + startDate);
        }
        return Math.max(initialNetCashPerShare - dailyBurnPerShare * elapsedDays, 0.0);
    }

    public CashFloorEstimate sample(LocalDate date, double price) {
        double netCash = netCashAt(date);
        double ratio = netCash > 0 ? price / netCash : Double.POSITIVE_INFINITY;
        boolean breached = ratio < warningThreshold;

        CashFloorAlert alert = CashFloorAlert.NONE;
        String warning = null;
        boolean thesisIntact = true;

        if (netCash <= 0) {
            alert = CashFloorAlert.CASH_EXHAUSTED;
            warning = "Estimated net cash has been fully burned";
            thesisIntact = false;
        } else if (ratio > premiumWarningRatio) {
            alert = CashFloorAlert.PREMIUM_TO_CASH;
            warning = String.format("Stock ($%.2f) trading at %.1fx estimated cash ($%.2f), downside protection weakened",
                    price, ratio, netCash);
        } else if (breached) {
            alert = CashFloorAlert.BELOW_CASH;
            warning = String.format("Stock ($%.2f) trading below estimated cash ($%.2f)", price, netCash);
        }

        if (netCash > 0 && netCash < initialNetCashPerShare * BURN_ALERT_FRACTION) {
            alert = CashFloorAlert.BURN_ALERT;
            warning = String.format("Cash burn alert: estimated cash $%.2f is below 50%% of initial $%.2f",
                    netCash, initialNetCashPerShare);
            thesisIntact = false;
        }

        return new CashFloorEstimate(date, price, netCash, ratio, breached, thesisIntact, alert, warning);
    }
}
