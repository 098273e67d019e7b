package com.coveredcall.backtest.engine.lifecycle;

import com.coveredcall.backtest.dto.Position;

import java.time.LocalDate;

/**
 * Day state handed to each {@link LifecycleRule}.
 *
 * @param position      the open short call
 * @param date          evaluation date
 * @param spot          underlying close
 * @param volatility    implied volatility proxy for the day
 * @param daysRemaining calendar days to expiration, zero or negative once expired
 */
public record LifecycleContext(
        Position position,
        LocalDate date,
        double spot,
        double volatility,
        long daysRemaining
) {

    public static LifecycleContext of(Position position, LocalDate date, double spot, double volatility) {
        return new LifecycleContext(position, date, spot, volatility,
                position.contract().daysToExpiration(date));
    }
}
