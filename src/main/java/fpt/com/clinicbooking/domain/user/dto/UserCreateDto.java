package fpt.com.clinicbooking.domain.user.dto;

import fpt.com.clinicbooking.domain.user.entity.UserRole;
import jakarta.validation.constraints.*;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserCreateDto {

    @NotBlank(message = "USERNAME_REQUIRED")
    @Pattern(regexp = "^[A-Za-z0-9._-]{3,50}$", message = "USERNAME_PATTERN")
    private String username;

    @NotBlank(message = "EMAIL_REQUIRED")
    @Email(message = "EMAIL_INVALID")
    @Size(max = 255, message = "EMAIL_SIZE")
    private String email;

    @NotBlank(message = "PASSWORD_REQUIRED")
    @Size(min = 8, max = 128, message = "PASSWORD_SIZE")
    private String password;

    @NotBlank(message = "FULL_NAME_REQUIRED")
    @Size(max = 200, message = "FULL_NAME_SIZE")
    private String fullName;

    private UserRole role;
}
