package com.coveredcall.exception;

/**
 * Malformed or out-of-range numeric input to pricing or strategy configuration.
 */
public class InvalidInputException extends BacktestException {

    public InvalidInputException(String message) {
        super(ErrorCode.INVALID_INPUT, message);
    }
}
