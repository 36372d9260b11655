package net.javahippie.fittracker.security;

import net.javahippie.fittracker.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Input rules for account credentials: email shape, password strength and full name.
 */
@Component
public class CredentialPolicy {

    static final int MIN_PASSWORD_LENGTH = 8;
    static final int MIN_FULL_NAME_LENGTH = 2;
    static final int MAX_FULL_NAME_LENGTH = 100;
    static final int MAX_EMAIL_LENGTH = 254;

    // one '@', no whitespace, and a '.' somewhere after the '@' with text on both sides
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    /**
     * Trim and lower-case an email so lookups and uniqueness are case-insensitive.
     *
     * @param email raw email, may be null
     * @return normalized email, or null
     */
    public String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public void validateEmail(String email) {
        if (email == null || !EMAIL_PATTERN.matcher(email.trim()).matches()) {
            throw new ValidationException("Invalid email format");
        }
        if (email.trim().length() > MAX_EMAIL_LENGTH) {
            throw new ValidationException("Email must not exceed " + MAX_EMAIL_LENGTH + " characters");
        }
    }

    /**
     * Collect every password-strength rule the password violates.
     *
     * @param password the candidate password
     * @return violated rules, empty if the password is acceptable
     */
    public List<String> passwordErrors(String password) {
        List<String> errors = new ArrayList<>();
        if (password == null) {
            errors.add("Password is required");
            return errors;
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            errors.add("Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }
        if (password.chars().noneMatch(Character::isUpperCase)) {
            errors.add("Password must contain at least one uppercase letter");
        }
        if (password.chars().noneMatch(Character::isLowerCase)) {
            errors.add("Password must contain at least one lowercase letter");
        }
        if (password.chars().noneMatch(Character::isDigit)) {
            errors.add("Password must contain at least one number");
        }
        return errors;
    }

    public void validatePassword(String password) {
        List<String> errors = passwordErrors(password);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * Validate and trim a full name.
     *
     * @return the trimmed name
     */
    public String validateFullName(String fullName) {
        String trimmed = fullName == null ? "" : fullName.trim();
        if (trimmed.length() < MIN_FULL_NAME_LENGTH) {
            throw new ValidationException("Full name must be at least " + MIN_FULL_NAME_LENGTH + " characters");
        }
        if (trimmed.length() > MAX_FULL_NAME_LENGTH) {
            throw new ValidationException("Full name must not exceed " + MAX_FULL_NAME_LENGTH + " characters");
        }
        return trimmed;
    }
}
