package net.javahippie.fittracker.exception;

/**
 * Exception thrown when registering an email that already belongs to an account.
 */
public class DuplicateEmailException extends RuntimeException {

    public DuplicateEmailException(String message) {
        super(message);
    }

    public DuplicateEmailException(String message, Throwable cause) {
        super(message, cause);
    }
}
