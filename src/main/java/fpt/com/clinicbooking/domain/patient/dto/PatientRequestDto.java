package fpt.com.clinicbooking.domain.patient.dto;

import fpt.com.clinicbooking.domain.patient.entity.Gender;
import jakarta.validation.constraints.*;
import lombok.*;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientRequestDto {

    @NotBlank(message = "FIRST_NAME_REQUIRED")
    @Size(max = 100, message = "FIRST_NAME_SIZE")
    private String firstName;

    @NotBlank(message = "LAST_NAME_REQUIRED")
    @Size(max = 100, message = "LAST_NAME_SIZE")
    private String lastName;

    @Size(max = 50, message = "NATIONAL_ID_SIZE")
    private String nationalId;

    @Past(message = "DATE_OF_BIRTH_PAST")
    private LocalDate dateOfBirth;

    private Gender gender;

    @Size(max = 30, message = "PHONE_SIZE")
    private String phone;

    @Email(message = "EMAIL_INVALID")
    @Size(max = 255, message = "EMAIL_SIZE")
    private String email;

    private String address;

    @Size(max = 200, message = "EMERGENCY_CONTACT_NAME_SIZE")
    private String emergencyContactName;

    @Size(max = 30, message = "EMERGENCY_CONTACT_PHONE_SIZE")
    private String emergencyContactPhone;
}
