package com.example.cloudmedia.service;

import com.example.cloudmedia.persistence.MetadataStore;
import com.example.cloudmedia.persistence.document.UserDocument;
import com.example.cloudmedia.security.PasswordHasher;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class UserMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(UserMaintenanceService.class);
    private static final int MAX_HASH_LENGTH = 200;
    private static final List<String> BCRYPT_PREFIXES = List.of("$2a$", "$2b$", "$2y$");

    public enum HashStatus {
        OK,
        EMPTY,
        TOO_LONG,
        NOT_BCRYPT
    }

    public record PasswordHashAudit(String userId, String email, int hashLength, HashStatus status) {
    }

    private final MetadataStore metadataStore;
    private final PasswordHasher passwordHasher;

    public List<PasswordHashAudit> auditPasswordHashes() {
        List<PasswordHashAudit> report = metadataStore.findAllUsers().stream()
            .map(this::audit)
            .toList();
        log.info("Audited {} users", report.size());
        for (PasswordHashAudit entry : report) {
            if (entry.status() == HashStatus.OK) {
                log.info("User {} ({}): hash OK", entry.email(), entry.userId());
            } else {
                log.warn("User {} ({}): hash {} (length {})", entry.email(), entry.userId(), entry.status(), entry.hashLength());
            }
        }
        return report;
    }

    public boolean resetPassword(String email, String newPassword) {
        Assert.hasText(newPassword, "password required");
        Optional<UserDocument> user = metadataStore.findUserByEmail(AuthService.normalizeEmail(email));
        if (user.isEmpty()) {
            log.error("Cannot reset password, no user with email {}", email);
            return false;
        }
        boolean updated = metadataStore.updateUserPasswordHash(user.get().getId(), passwordHasher.hash(newPassword))
            .isPresent();
        if (updated) {
            log.info("Password reset for user {}", user.get().getId());
        }
        return updated;
    }

    private PasswordHashAudit audit(UserDocument user) {
        String hash = user.getPasswordHash();
        int length = hash == null ? 0 : hash.length();
        HashStatus status;
        if (!StringUtils.hasText(hash)) {
            status = HashStatus.EMPTY;
        } else if (length > MAX_HASH_LENGTH) {
            status = HashStatus.TOO_LONG;
        } else if (BCRYPT_PREFIXES.stream().noneMatch(hash::startsWith)) {
            status = HashStatus.NOT_BCRYPT;
        } else {
            status = HashStatus.OK;
        }
        return new PasswordHashAudit(user.getId(), user.getEmail(), length, status);
    }
}
