package com.campus.lending.config;

import com.campus.lending.service.UserService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the system administrator from {@code lending.bootstrap-admin.*} on startup when
 * the database has none. Every other staff account is created by that administrator.
 */
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrap.class);

    private final LendingProperties properties;
    private final UserService userService;

    @Override
    public void run(ApplicationArguments args) {
        LendingProperties.BootstrapAdmin admin = properties.bootstrapAdmin();
        if (admin == null || !admin.isConfigured()) {
            log.info("lending.bootstrap-admin.email is not set, no administrator is bootstrapped");
            return;
        }
        userService.createInitialAdmin(admin.email(), admin.password(), admin.fullName());
    }
}
