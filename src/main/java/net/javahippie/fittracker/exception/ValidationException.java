package net.javahippie.fittracker.exception;

import java.util.List;

/**
 * Exception thrown when caller input (email, password, name, profile or activity fields)
 * does not satisfy the validation rules. Carries every violated rule.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> errors) {
        super(String.join(". ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
