package com.workqueue.core;

/**
 * Base unchecked exception for the work queue, tagged with an {@link ErrorKind}.
 *
 * <p><b>Example Handling:</b></p>
 * <pre>{@code
 * try {
 *     jobService.create(request);
 * } catch (QueueException e) {
 *     if (e.getKind() == ErrorKind.VALIDATION) {
 *         // reject the request, nothing was persisted
 *     }
 * }
 * }</pre>
 */
public class QueueException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Create a new QueueException.
     *
     * @param kind    the failure kind
     * @param message the error message
     */
    public QueueException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Create a new QueueException with a cause.
     *
     * @param kind    the failure kind
     * @param message the error message
     * @param cause   the underlying cause
     */
    public QueueException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Get the failure kind.
     *
     * @return the kind this exception was raised with
     */
    public ErrorKind getKind() {
        return kind;
    }
}
