package com.suraksha.safetymonitor.exception;

/**
 * Base class for every failure this service reports to a caller.
 */
public abstract class SafetyException extends RuntimeException {

    private final ErrorCode errorCode;

    protected SafetyException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SafetyException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
