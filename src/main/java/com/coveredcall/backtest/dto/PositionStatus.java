package com.coveredcall.backtest.dto;

/**
 * Lifecycle of the single short call. The three terminal outcomes always
 * return the book to {@link #NONE}.
 */
public enum PositionStatus {
    NONE,
    OPEN,
    EXPIRED_WORTHLESS,
    CALLED_AWAY,
    ROLLED;

    public boolean isTerminal() {
        return this == EXPIRED_WORTHLESS || this == CALLED_AWAY || this == ROLLED;
    }
}
