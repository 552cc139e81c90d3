package com.suraksha.safetymonitor.exception;

/**
 * Backing store unavailable. Nothing was persisted; the client is expected to retry.
 */
public class StorageException extends SafetyException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
