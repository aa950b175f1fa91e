package fpt.com.clinicbooking.domain.user.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.user.dto.UserCreateDto;
import fpt.com.clinicbooking.domain.user.dto.UserDto;
import fpt.com.clinicbooking.domain.user.dto.UserUpdateDto;
import fpt.com.clinicbooking.domain.user.entity.User;
import fpt.com.clinicbooking.domain.user.entity.UserRole;
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserDto create(UserCreateDto dto) {
        String username = dto.getUsername().trim();
        String email = dto.getEmail().trim().toLowerCase();

        if (userRepository.existsByUsernameIgnoreCase(username)) throw new ConflictException("USERNAME_EXISTS");
        if (userRepository.existsByEmailIgnoreCase(email)) throw new ConflictException("EMAIL_EXISTS");

        User user = User.builder()
                .username(username)
                .email(email)
                .fullName(dto.getFullName().trim())
                .passwordHash(passwordEncoder.encode(dto.getPassword()))
                .role(dto.getRole() != null ? dto.getRole() : UserRole.RECEPTIONIST)
                .active(true)
                .build();

        User saved = userRepository.save(user);
        log.info("User {} created with role {}", saved.getId(), saved.getRole().getValue());
        return toDto(saved);
    }

    @Transactional(readOnly = true)
    public UserDto get(Integer id) {
        return toDto(findUser(id));
    }

    @Transactional(readOnly = true)
    public PaginationResponse<UserDto> search(String q, UserRole role, Boolean active, Pageable pageable) {
        return PaginationResponse.fromPage(userRepository.search(q, role, active, pageable), this::toDto);
    }

    public UserDto update(Integer id, UserUpdateDto dto) {
        User user = findUser(id);

        if (dto.getFullName() != null && !dto.getFullName().isBlank()) user.setFullName(dto.getFullName().trim());
        if (dto.getEmail() != null && !dto.getEmail().equalsIgnoreCase(user.getEmail())) {
            String email = dto.getEmail().trim().toLowerCase();
            if (userRepository.existsByEmailIgnoreCaseAndIdNot(email, id)) throw new ConflictException("EMAIL_EXISTS");
            user.setEmail(email);
        }
        if (dto.getRole() != null) user.setRole(dto.getRole());
        if (dto.getActive() != null) user.setActive(dto.getActive());
        if (dto.getNewPassword() != null && !dto.getNewPassword().isBlank()) {
            user.setPasswordHash(passwordEncoder.encode(dto.getNewPassword()));
        }

        return toDto(userRepository.save(user));
    }

    /**
     * Accounts are never removed through the API; they are switched off instead.
     */
    public void deactivate(Integer id) {
        User user = findUser(id);
        user.setActive(false);
        userRepository.save(user);
        log.info("User {} deactivated", id);
    }

    private User findUser(Integer id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", Map.of("id", id)));
    }

    private UserDto toDto(User u) {
        return UserDto.builder()
                .id(u.getId())
                .username(u.getUsername())
                .email(u.getEmail())
                .fullName(u.getFullName())
                .role(u.getRole())
                .active(u.isActive())
                .createdAt(u.getCreatedAt())
                .updatedAt(u.getUpdatedAt())
                .build();
    }
}
