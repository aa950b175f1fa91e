package fpt.com.clinicbooking.domain.doctor.dto;

import jakarta.validation.constraints.*;
import lombok.*;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DoctorRequestDto {

    // optional login account
    private Integer userId;

    @NotBlank(message = "FIRST_NAME_REQUIRED")
    @Size(max = 100, message = "FIRST_NAME_SIZE")
    private String firstName;

    @NotBlank(message = "LAST_NAME_REQUIRED")
    @Size(max = 100, message = "LAST_NAME_SIZE")
    private String lastName;

    @Size(max = 30, message = "PHONE_SIZE")
    private String phone;

    @Email(message = "EMAIL_INVALID")
    @Size(max = 255, message = "EMAIL_SIZE")
    private String email;

    @NotBlank(message = "LICENSE_NUMBER_REQUIRED")
    @Size(max = 100, message = "LICENSE_NUMBER_SIZE")
    private String licenseNumber;

    @PastOrPresent(message = "HIRE_DATE_FUTURE")
    private LocalDate hireDate;

    // only read on create
    private List<Integer> specialtyIds;
}
