package com.suraksha.safetymonitor.exception;

/**
 * Delivery to a live subscriber failed. Best-effort only: the broadcaster logs
 * it and drops the subscriber, it never reaches the request that published.
 */
public class BroadcastException extends SafetyException {

    public BroadcastException(String message, Throwable cause) {
        super(ErrorCode.BROADCAST_FAILED, message, cause);
    }
}
