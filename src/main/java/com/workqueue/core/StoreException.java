package com.workqueue.core;

import java.sql.SQLException;

/**
 * Wraps a {@link SQLException} at the service boundary so callers of the
 * administrative API deal with one unchecked exception family.
 */
public class StoreException extends QueueException {

    public StoreException(String message, SQLException cause) {
        super(ErrorKind.STORE, message + ": " + cause.getMessage(), cause);
    }
}
