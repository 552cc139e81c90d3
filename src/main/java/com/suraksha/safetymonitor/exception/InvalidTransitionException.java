package com.suraksha.safetymonitor.exception;

/** Illegal lifecycle move, or a concurrent update won the race. */
public class InvalidTransitionException extends SafetyException {

    public InvalidTransitionException(String message) {
        super(ErrorCode.INVALID_TRANSITION, message);
    }

    public InvalidTransitionException(String message, Throwable cause) {
        super(ErrorCode.INVALID_TRANSITION, message, cause);
    }
}
