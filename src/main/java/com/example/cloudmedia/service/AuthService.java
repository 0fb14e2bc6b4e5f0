package com.example.cloudmedia.service;

import com.example.cloudmedia.exception.ConflictException;
import com.example.cloudmedia.exception.UnauthorizedException;
import com.example.cloudmedia.model.AuthResponse;
import com.example.cloudmedia.model.UserView;
import com.example.cloudmedia.persistence.CreateResult;
import com.example.cloudmedia.persistence.MetadataStore;
import com.example.cloudmedia.persistence.document.UserDocument;
import com.example.cloudmedia.security.PasswordHasher;
import com.example.cloudmedia.security.TokenClaims;
import com.example.cloudmedia.security.TokenService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final MetadataStore metadataStore;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;
    private final Clock clock;

    public AuthResponse register(String username, String email, String password) {
        Assert.hasText(username, "username required");
        Assert.hasText(email, "email required");
        Assert.hasText(password, "password required");

        String normalizedEmail = normalizeEmail(email);
        log.info("Registration attempt for {}", normalizedEmail);
        if (metadataStore.findUserByEmail(normalizedEmail).isPresent()) {
            log.warn("Registration rejected, email already in use: {}", normalizedEmail);
            throw new ConflictException("User with this email already exists");
        }

        UserDocument user = UserDocument.builder()
            .id(UUID.randomUUID().toString())
            .username(username.trim())
            .email(normalizedEmail)
            .passwordHash(passwordHasher.hash(password))
            .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
            .build();

        CreateResult<UserDocument> result = metadataStore.createUser(user);
        UserDocument created = result.createdValue()
            .orElseThrow(() -> new ConflictException("User with this email already exists"));
        log.info("Registered user {}", created.getId());
        return authenticated(created);
    }

    public AuthResponse login(String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        Optional<UserDocument> user = metadataStore.findUserByEmail(normalizedEmail);
        if (user.isEmpty() || !passwordHasher.matches(password, user.get().getPasswordHash())) {
            log.warn("Login failed for {}", normalizedEmail);
            throw new UnauthorizedException("Invalid email or password");
        }
        log.info("Login successful for user {}", user.get().getId());
        return authenticated(user.get());
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private AuthResponse authenticated(UserDocument user) {
        String token = tokenService.issue(new TokenClaims(user.getId(), user.getEmail()));
        return new AuthResponse(token, toView(user));
    }

    private UserView toView(UserDocument user) {
        return UserView.builder()
            .id(user.getId())
            .username(user.getUsername())
            .email(user.getEmail())
            .createdAt(user.getCreatedAt())
            .build();
    }
}
