package com.suraksha.safetymonitor.exception;

/** Malformed input. Rejected before any side effect. */
public class ValidationException extends SafetyException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
