package fpt.com.clinicbooking.common.config;

import fpt.com.clinicbooking.domain.user.entity.User;
import fpt.com.clinicbooking.domain.user.entity.UserRole;
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.crypto.password.PasswordEncoder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DefaultAdminInitializerTest {

    private UserRepository userRepository;
    private PasswordEncoder passwordEncoder;
    private ClinicProperties properties;
    private DefaultAdminInitializer initializer;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        passwordEncoder = mock(PasswordEncoder.class);
        properties = new ClinicProperties();
        initializer = new DefaultAdminInitializer(userRepository, passwordEncoder, properties);
    }

    @Test
    void run_doesNothing_whenDisabled() {
        initializer.run(null);

        verifyNoInteractions(userRepository, passwordEncoder);
    }

    @Test
    void run_skips_whenPasswordMissing() {
        properties.getBootstrap().getAdmin().setEnabled(true);

        initializer.run(null);

        verify(userRepository, never()).save(any());
    }

    @Test
    void run_skips_whenAdminAlreadyExists() {
        properties.getBootstrap().getAdmin().setEnabled(true);
        properties.getBootstrap().getAdmin().setPassword("change-me-now");
        when(userRepository.existsByUsernameIgnoreCase("admin")).thenReturn(true);

        initializer.run(null);

        verify(userRepository, never()).save(any());
    }

    @Test
    void run_createsActiveAdminWithHashedPassword() {
        properties.getBootstrap().getAdmin().setEnabled(true);
        properties.getBootstrap().getAdmin().setPassword("change-me-now");
        properties.getBootstrap().getAdmin().setEmail("Root@Clinic.Local");
        when(userRepository.existsByUsernameIgnoreCase("admin")).thenReturn(false);
        when(passwordEncoder.encode("change-me-now")).thenReturn("$argon2id$hash");

        initializer.run(null);

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        User admin = captor.getValue();
        assertEquals("admin", admin.getUsername());
        assertEquals("root@clinic.local", admin.getEmail());
        assertEquals("$argon2id$hash", admin.getPasswordHash());
        assertEquals(UserRole.ADMIN, admin.getRole());
        assertTrue(admin.isActive());
    }
}
