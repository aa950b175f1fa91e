package fpt.com.clinicbooking.domain.patient.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import fpt.com.clinicbooking.domain.doctor.repository.DoctorRepository;
import fpt.com.clinicbooking.domain.patient.dto.PatientDoctorDto;
import fpt.com.clinicbooking.domain.patient.dto.PatientDoctorRequestDto;
import fpt.com.clinicbooking.domain.patient.entity.Patient;
import fpt.com.clinicbooking.domain.patient.entity.PatientDoctor;
import fpt.com.clinicbooking.domain.patient.entity.PatientDoctorId;
import fpt.com.clinicbooking.domain.patient.repository.PatientDoctorRepository;
import fpt.com.clinicbooking.domain.patient.repository.PatientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Care team of a patient. Several doctors may be flagged primary at once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class PatientDoctorService {

    private final PatientDoctorRepository repository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;

    public PatientDoctorDto assign(Integer patientId, PatientDoctorRequestDto dto) {
        Patient patient = patientRepository.findById(patientId)
                .orElseThrow(() -> new NotFoundException("PATIENT_NOT_FOUND", Map.of("id", patientId)));
        Doctor doctor = doctorRepository.findById(dto.getDoctorId())
                .orElseThrow(() -> new NotFoundException("DOCTOR_NOT_FOUND", Map.of("id", dto.getDoctorId())));

        // save() would merge over an existing row, so check first
        if (repository.existsById(new PatientDoctorId(patientId, doctor.getId()))) {
            throw new ConflictException("DOCTOR_ALREADY_ASSIGNED",
                    Map.of("patientId", patientId, "doctorId", doctor.getId()));
        }

        PatientDoctor link = PatientDoctor.builder()
                .id(new PatientDoctorId(patientId, doctor.getId()))
                .patient(patient)
                .doctor(doctor)
                .primary(Boolean.TRUE.equals(dto.getPrimary()))
                .assignedDate(dto.getAssignedDate() != null ? dto.getAssignedDate() : LocalDate.now())
                .build();

        PatientDoctor saved = repository.save(link);
        log.info("Doctor {} assigned to patient {}", doctor.getId(), patientId);
        return toDto(saved);
    }

    @Transactional(readOnly = true)
    public List<PatientDoctorDto> getCareTeam(Integer patientId) {
        if (!patientRepository.existsById(patientId)) {
            throw new NotFoundException("PATIENT_NOT_FOUND", Map.of("id", patientId));
        }
        return repository.findByPatient_IdOrderByPrimaryDescAssignedDateAsc(patientId)
                .stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    public PatientDoctorDto setPrimary(Integer patientId, Integer doctorId, boolean primary) {
        PatientDoctor link = findLink(patientId, doctorId);
        link.setPrimary(primary);
        return toDto(repository.save(link));
    }

    public void unassign(Integer patientId, Integer doctorId) {
        repository.delete(findLink(patientId, doctorId));
        log.info("Doctor {} removed from patient {}", doctorId, patientId);
    }

    private PatientDoctor findLink(Integer patientId, Integer doctorId) {
        return repository.findById(new PatientDoctorId(patientId, doctorId))
                .orElseThrow(() -> new NotFoundException("PATIENT_DOCTOR_NOT_FOUND",
                        Map.of("patientId", patientId, "doctorId", doctorId)));
    }

    private PatientDoctorDto toDto(PatientDoctor link) {
        Doctor d = link.getDoctor();
        return new PatientDoctorDto(
                link.getId().getPatientId(),
                link.getId().getDoctorId(),
                d.getFullName(),
                link.isPrimary(),
                link.getAssignedDate()
        );
    }
}
