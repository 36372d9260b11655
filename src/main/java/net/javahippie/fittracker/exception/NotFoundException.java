package net.javahippie.fittracker.exception;

/**
 * Exception thrown when an operation targets a user or activity that does not exist
 * or is not owned by the calling user.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
