package org.cronpulse.errors;

/**
 * Persistence layer unreachable or failing. Wraps the underlying {@link java.sql.SQLException}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
