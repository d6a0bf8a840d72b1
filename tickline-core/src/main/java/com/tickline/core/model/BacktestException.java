package com.tickline.core.model;

/**
 * Exception for backtest errors that must abort a run or reject its inputs.
 * Financial edge cases (insufficient cash, closing a missing position) are
 * never reported through this type.
 */
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        INVALID_CONFIG,
        INVALID_MARKET_DATA,
        NO_WINDOWS,
        SIMULATION_ERROR
    }

    private final ErrorCode errorCode;

    public BacktestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BacktestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
