package net.javahippie.fittracker.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.codec.Utf8;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;
import org.springframework.security.crypto.password.PasswordEncoder;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * Password encoder producing {@code salt:digest} credentials.
 *
 * <p>The salt is 16 random bytes from a {@link java.security.SecureRandom}, hex encoded. The digest is
 * PBKDF2-HMAC-SHA256 of the password keyed by that salt, with a configurable iteration count and
 * key length, hex encoded.</p>
 *
 * <p>Changing the iteration count invalidates existing credentials, since the count is not part of
 * the stored string.</p>
 */
@Slf4j
public class SaltedPbkdf2PasswordEncoder implements PasswordEncoder {

    static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    static final int SALT_LENGTH_BYTES = 16;
    private static final char DELIMITER = ':';

    private final BytesKeyGenerator saltGenerator = KeyGenerators.secureRandom(SALT_LENGTH_BYTES);
    private final int iterations;
    private final int keyLengthBits;

    public SaltedPbkdf2PasswordEncoder(int iterations, int keyLengthBits) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Iterations must be positive: " + iterations);
        }
        if (keyLengthBits < 128 || keyLengthBits % 8 != 0) {
            throw new IllegalArgumentException("Key length must be a multiple of 8 and at least 128 bits: " + keyLengthBits);
        }
        this.iterations = iterations;
        this.keyLengthBits = keyLengthBits;
    }

    /**
     * Generate a fresh hex-encoded salt.
     *
     * @return 32 hex characters
     */
    public String generateSalt() {
        return new String(Hex.encode(saltGenerator.generateKey()));
    }

    /**
     * Derive the hex digest of a password with the given salt.
     *
     * @param rawPassword the plaintext password, must not be empty
     * @param salt the hex salt
     * @return hex-encoded derived key
     */
    public String hash(CharSequence rawPassword, String salt) {
        PBEKeySpec spec = new PBEKeySpec(rawPassword.toString().toCharArray(), Utf8.encode(salt), iterations, keyLengthBits);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(ALGORITHM);
            return new String(Hex.encode(factory.generateSecret(spec).getEncoded()));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive password hash", e);
        } finally {
            spec.clearPassword();
        }
    }

    @Override
    public String encode(CharSequence rawPassword) {
        if (rawPassword == null || rawPassword.length() == 0) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        String salt = generateSalt();
        return salt + DELIMITER + hash(rawPassword, salt);
    }

    /**
     * Verify a password against a stored {@code salt:digest} credential in constant time.
     * Returns false for null input and malformed credentials instead of throwing.
     */
    @Override
    public boolean matches(CharSequence rawPassword, String encodedPassword) {
        if (rawPassword == null || rawPassword.length() == 0 || encodedPassword == null) {
            return false;
        }

        int split = encodedPassword.indexOf(DELIMITER);
        if (split <= 0 || split != encodedPassword.lastIndexOf(DELIMITER) || split == encodedPassword.length() - 1) {
            log.debug("Stored credential is malformed");
            return false;
        }

        String salt = encodedPassword.substring(0, split);
        String expected = encodedPassword.substring(split + 1);
        String actual = hash(rawPassword, salt);

        return MessageDigest.isEqual(Utf8.encode(expected), Utf8.encode(actual));
    }
}
