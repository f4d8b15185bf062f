package com.workqueue.core;

/**
 * Kinds of failure the queue distinguishes. Callers branch on the kind carried by a
 * {@link QueueException} rather than on the exception class.
 *
 * <p>A conditional state change that finds the row already moved on is not listed:
 * the repositories report it as a {@code false} return and callers carry on.</p>
 */
public enum ErrorKind {
    /** Bad target reference, bad list encoding or arity mismatch at creation time. */
    VALIDATION,
    /** The target operation raised while a job was running. */
    EXECUTION,
    /** The backing store could not complete a request. */
    STORE
}
