package com.example.cloudmedia.security;

import com.example.cloudmedia.config.AuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

@Component
public class PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    private final BCryptPasswordEncoder passwordEncoder;

    public PasswordHasher(AuthProperties properties) {
        this.passwordEncoder = new BCryptPasswordEncoder(properties.getBcryptStrength());
    }

    public String hash(String plaintext) {
        Assert.notNull(plaintext, "password required");
        return passwordEncoder.encode(plaintext);
    }

    public boolean matches(String plaintext, String hash) {
        if (plaintext == null || !StringUtils.hasText(hash)) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, hash);
        } catch (IllegalArgumentException ex) {
            log.warn("Stored password hash could not be verified: {}", ex.getMessage());
            return false;
        }
    }
}
