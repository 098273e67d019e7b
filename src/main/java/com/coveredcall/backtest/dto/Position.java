package com.coveredcall.backtest.dto;

import java.time.LocalDate;

/**
 * The open short call written against the share position.
 *
 * @param contract         strike and expiration
 * @param contracts        number of contracts sold
 * @param premiumReceived  total premium received at open, net of spread and commission
 * @param openDate         sale date
 * @param spotAtOpen       underlying close on the sale date
 * @param volatilityAtOpen implied volatility proxy used to price the sale
 * @param status           {@link PositionStatus#OPEN} while live
 */
public record Position(
        OptionContract contract,
        int contracts,
        double premiumReceived,
        LocalDate openDate,
        double spotAtOpen,
        double volatilityAtOpen,
        PositionStatus status
) {

    public double strike() {
        return contract.strike();
    }

    public LocalDate expiration() {
        return contract.expiration();
    }
}
