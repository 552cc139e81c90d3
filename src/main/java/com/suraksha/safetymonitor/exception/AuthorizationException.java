package com.suraksha.safetymonitor.exception;

/** Actor's role does not allow the requested action. Raised before any mutation. */
public class AuthorizationException extends SafetyException {

    public AuthorizationException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
