package fpt.com.clinicbooking.domain.doctor.dto;

import fpt.com.clinicbooking.domain.masterdata.dto.SpecialtyDto;
import fpt.com.clinicbooking.domain.user.dto.UserSummaryDto;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DoctorDto {
    private Integer id;
    private UserSummaryDto user;
    private String firstName;
    private String lastName;
    private String fullName;
    private String phone;
    private String email;
    private String licenseNumber;
    private LocalDate hireDate;
    private List<SpecialtyDto> specialties;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
