package org.cronpulse.services;

/**
 * Raised by a {@link JobHandler} when the invoked capability reports failure.
 */
public class HandlerException extends Exception {

    public HandlerException(String message) {
        super(message);
    }

    public HandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
