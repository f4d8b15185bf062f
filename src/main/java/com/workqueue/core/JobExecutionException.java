package com.workqueue.core;

/**
 * Raised while running a job: an argument could not be decoded for its declared
 * parameter kind, or the target operation itself failed. The worker records the
 * message on the job as its error info; it never reaches the dispatcher loop.
 */
public class JobExecutionException extends QueueException {

    public JobExecutionException(String message) {
        super(ErrorKind.EXECUTION, message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION, message, cause);
    }
}
