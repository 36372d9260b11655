package net.javahippie.fittracker.exception;

/**
 * Exception thrown when a password does not verify.
 * Unknown email and wrong password produce the same message.
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException(String message) {
        super(message);
    }
}
