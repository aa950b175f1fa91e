package fpt.com.clinicbooking.domain.patient.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;

@Getter
@AllArgsConstructor
public class PatientDoctorDto {
    private Integer patientId;
    private Integer doctorId;
    private String doctorName;
    private boolean primary;
    private LocalDate assignedDate;
}
