package com.coveredcall.backtest.dto;

import java.time.LocalDate;

/**
 * Estimated net cash per share on one day and how the price relates to it.
 *
 * @param priceToCashRatio price divided by the floor, infinite once the floor reaches zero
 * @param breached         ratio fell below the configured warning threshold
 */
public record CashFloorEstimate(
        LocalDate date,
        double price,
        double netCashPerShare,
        double priceToCashRatio,
        boolean breached,
        boolean thesisIntact,
        CashFloorAlert alert,
        String warning
) {
}
