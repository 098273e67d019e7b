package com.coveredcall.exception;

import lombok.Getter;

/**
 * Volatility estimation was requested before enough trailing bars exist.
 * Callers either skip the day or seed a default volatility.
 */
@Getter
public class InsufficientHistoryException extends BacktestException {

    private final int requiredBars;
    private final int availableBars;

    public InsufficientHistoryException(int requiredBars, int availableBars) {
        super(ErrorCode.INSUFFICIENT_HISTORY,
                "Volatility estimate needs " + requiredBars + " bars, only " + availableBars + " available");
        this.requiredBars = requiredBars;
        this.availableBars = availableBars;
    }
}
