package com.example.cloudmedia.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class UserMaintenanceRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(UserMaintenanceRunner.class);

    static final String AUDIT_OPTION = "audit-users";
    static final String RESET_EMAIL_OPTION = "reset-password-email";
    static final String RESET_PASSWORD_OPTION = "reset-password";

    private final UserMaintenanceService maintenanceService;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(AUDIT_OPTION)) {
            maintenanceService.auditPasswordHashes();
        }
        if (args.containsOption(RESET_EMAIL_OPTION)) {
            String email = single(args.getOptionValues(RESET_EMAIL_OPTION));
            String password = single(args.getOptionValues(RESET_PASSWORD_OPTION));
            if (email == null || password == null) {
                log.error("Password reset needs both --{} and --{}", RESET_EMAIL_OPTION, RESET_PASSWORD_OPTION);
                return;
            }
            maintenanceService.resetPassword(email, password);
        }
    }

    private String single(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
