package fpt.com.clinicbooking.common.config;

import fpt.com.clinicbooking.domain.user.entity.User;
import fpt.com.clinicbooking.domain.user.entity.UserRole;
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Provisions the first admin account so a fresh database can be administered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultAdminInitializer implements ApplicationRunner {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final ClinicProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        ClinicProperties.Admin admin = properties.getBootstrap().getAdmin();
        if (!admin.isEnabled()) {
            return;
        }
        if (admin.getPassword() == null || admin.getPassword().isBlank()) {
            log.warn("Default admin bootstrap enabled but no password configured, skipping");
            return;
        }
        if (userRepository.existsByUsernameIgnoreCase(admin.getUsername())) {
            log.info("Admin user '{}' already exists", admin.getUsername());
            return;
        }

        User user = User.builder()
                .username(admin.getUsername())
                .email(admin.getEmail().toLowerCase())
                .fullName(admin.getFullName())
                .passwordHash(passwordEncoder.encode(admin.getPassword()))
                .role(UserRole.ADMIN)
                .active(true)
                .build();
        userRepository.save(user);
        log.info("Default admin user '{}' created", admin.getUsername());
    }
}
