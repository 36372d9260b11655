package net.javahippie.fittracker.config;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.fittracker.security.SaltedPbkdf2PasswordEncoder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Credential hashing configuration.
 * The PBKDF2 work factor is tunable per installation.
 */
@Configuration
@Slf4j
public class SecurityConfig {

    @Bean
    public PasswordEncoder passwordEncoder(
            @Value("${fittracker.security.pbkdf2-iterations:310000}") int iterations,
            @Value("${fittracker.security.key-length-bits:256}") int keyLengthBits) {
        log.info("Initialized password encoder: iterations={}, keyLengthBits={}", iterations, keyLengthBits);
        return new SaltedPbkdf2PasswordEncoder(iterations, keyLengthBits);
    }
}
