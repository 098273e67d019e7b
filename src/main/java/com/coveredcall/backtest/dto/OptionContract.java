package com.coveredcall.backtest.dto;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * A call contract, fixed for the life of one sale.
 */
public record OptionContract(double strike, LocalDate expiration, OptionType type) {

    public enum OptionType { CALL }

    public static OptionContract call(double strike, LocalDate expiration) {
        return new OptionContract(strike, expiration, OptionType.CALL);
    }

    /**
     * Calendar days left until expiration, negative once past it.
     */
    public long daysToExpiration(LocalDate asOf) {
        return ChronoUnit.DAYS.between(asOf, expiration);
    }

    public boolean isExpiredOn(LocalDate date) {
        return !date.isBefore(expiration);
    }
}
