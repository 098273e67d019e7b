package com.coveredcall.backtest.dto;

/**
 * Advisory level of the cash-floor thesis on a given day.
 */
public enum CashFloorAlert {
    NONE,
    /** Price trades well above the estimated cash floor, downside protection weakened. */
    PREMIUM_TO_CASH,
    /** Price/floor ratio fell below the warning threshold. */
    BELOW_CASH,
    /** Estimated cash fell below half of the starting estimate. */
    BURN_ALERT,
    /** Estimated cash has been fully burned. */
    CASH_EXHAUSTED
}
