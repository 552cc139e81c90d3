package com.suraksha.safetymonitor.exception;

public class NotFoundException extends SafetyException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
