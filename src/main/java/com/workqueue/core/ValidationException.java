package com.workqueue.core;

/**
 * Raised synchronously when a job, cron entry or channel definition is rejected.
 * Nothing is persisted when this is thrown.
 */
public class ValidationException extends QueueException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
