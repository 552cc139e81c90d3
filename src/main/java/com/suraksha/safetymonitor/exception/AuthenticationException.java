package com.suraksha.safetymonitor.exception;

/** Request carried no identity from the auth middleware. */
public class AuthenticationException extends SafetyException {

    public AuthenticationException(String message) {
        super(ErrorCode.UNAUTHENTICATED, message);
    }
}
