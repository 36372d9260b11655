package net.javahippie.fittracker.exception;

/**
 * Exception thrown when local session storage cannot be written or removed.
 * Database failures are reported through Spring's DataAccessException hierarchy instead.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
