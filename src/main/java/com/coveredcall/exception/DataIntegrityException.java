package com.coveredcall.exception;

/**
 * Price series violates the ordering contract: empty series, duplicate or
 * backwards dates, an unexpected calendar gap, or a non-positive close.
 */
public class DataIntegrityException extends BacktestException {

    public DataIntegrityException(String message) {
        super(ErrorCode.DATA_INTEGRITY, message);
    }
}
