package fpt.com.clinicbooking.domain.user.dto;

import fpt.com.clinicbooking.domain.user.entity.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateDto {

    @Size(max = 200, message = "FULL_NAME_SIZE")
    private String fullName;

    @Email(message = "EMAIL_INVALID")
    @Size(max = 255, message = "EMAIL_SIZE")
    private String email;

    private UserRole role;

    private Boolean active;

    @Size(min = 8, max = 128, message = "PASSWORD_SIZE")
    private String newPassword;
}
