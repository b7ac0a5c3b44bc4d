package io.cadence.core;

import java.io.IOException;

/**
 * A durable write to the job store failed. The operation that raised it has not been applied.
 */
public class PersistenceException extends IOException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
