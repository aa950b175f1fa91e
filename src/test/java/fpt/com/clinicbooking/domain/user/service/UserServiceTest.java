package fpt.com.clinicbooking.domain.user.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.user.dto.UserCreateDto;
import fpt.com.clinicbooking.domain.user.dto.UserDto;
import fpt.com.clinicbooking.domain.user.dto.UserUpdateDto;
import fpt.com.clinicbooking.domain.user.entity.User;
import fpt.com.clinicbooking.domain.user.entity.UserRole;
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class UserServiceTest {

    private UserRepository userRepository;
    private PasswordEncoder passwordEncoder;
    private UserService userService;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        passwordEncoder = mock(PasswordEncoder.class);
        userService = new UserService(userRepository, passwordEncoder);
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            if (u.getId() == null) u.setId(7);
            return u;
        });
    }

    private UserCreateDto createDto() {
        return UserCreateDto.builder()
                .username(" jdoe ")
                .email("JDoe@Clinic.Local")
                .password("s3cret-pass")
                .fullName("John Doe")
                .build();
    }

    @Test
    void create_hashesPassword_andDefaultsToReceptionist() {
        when(passwordEncoder.encode("s3cret-pass")).thenReturn("hashed");

        UserDto dto = userService.create(createDto());

        assertEquals(7, dto.getId());
        assertEquals("jdoe", dto.getUsername());
        assertEquals("jdoe@clinic.local", dto.getEmail());
        assertEquals(UserRole.RECEPTIONIST, dto.getRole());
        assertTrue(dto.isActive());
        verify(userRepository).save(argThat(u -> "hashed".equals(u.getPasswordHash())));
    }

    @Test
    void create_rejectsTakenUsername() {
        when(userRepository.existsByUsernameIgnoreCase("jdoe")).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class, () -> userService.create(createDto()));

        assertEquals("USERNAME_EXISTS", ex.getCode());
        verify(userRepository, never()).save(any());
    }

    @Test
    void create_rejectsTakenEmail() {
        when(userRepository.existsByEmailIgnoreCase("jdoe@clinic.local")).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class, () -> userService.create(createDto()));

        assertEquals("EMAIL_EXISTS", ex.getCode());
    }

    @Test
    void update_changesRoleAndPassword() {
        User existing = User.builder().id(3).username("nina").email("nina@clinic.local")
                .fullName("Nina").passwordHash("old").build();
        when(userRepository.findById(3)).thenReturn(Optional.of(existing));
        when(passwordEncoder.encode("new-password")).thenReturn("new-hash");

        UserUpdateDto update = new UserUpdateDto();
        update.setRole(UserRole.PHARMACIST);
        update.setNewPassword("new-password");

        UserDto dto = userService.update(3, update);

        assertEquals(UserRole.PHARMACIST, dto.getRole());
        assertEquals("new-hash", existing.getPasswordHash());
    }

    @Test
    void deactivate_keepsRowButClearsActiveFlag() {
        User existing = User.builder().id(4).username("sam").email("sam@clinic.local")
                .fullName("Sam").passwordHash("x").build();
        when(userRepository.findById(4)).thenReturn(Optional.of(existing));

        userService.deactivate(4);

        assertFalse(existing.isActive());
        verify(userRepository, never()).delete(any());
    }

    @Test
    void get_throwsNotFound_forUnknownId() {
        when(userRepository.findById(99)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class, () -> userService.get(99));

        assertEquals("USER_NOT_FOUND", ex.getCode());
    }
}
