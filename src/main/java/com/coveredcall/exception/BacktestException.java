package com.coveredcall.exception;

/**
 * Exception for backtest-specific errors.
 * Carries a structured error code for API responses and comparison results.
 */
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        INVALID_INPUT,
        INSUFFICIENT_HISTORY,
        DATA_INTEGRITY,
        SIMULATION_ERROR,
        BACKTEST_DISABLED,
        RESULT_NOT_FOUND
    }

    private final ErrorCode errorCode;

    public BacktestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
