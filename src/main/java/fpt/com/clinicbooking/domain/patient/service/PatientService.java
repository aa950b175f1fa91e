package fpt.com.clinicbooking.domain.patient.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.invoice.repository.InvoiceRepository;
import fpt.com.clinicbooking.domain.patient.dto.PatientDto;
import fpt.com.clinicbooking.domain.patient.dto.PatientRequestDto;
import fpt.com.clinicbooking.domain.patient.entity.Gender;
import fpt.com.clinicbooking.domain.patient.entity.Patient;
import fpt.com.clinicbooking.domain.patient.repository.PatientRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class PatientService {

    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;
    private final InvoiceRepository invoiceRepository;

    public PatientDto create(PatientRequestDto dto) {
        String nationalId = trimToNull(dto.getNationalId());
        if (nationalId != null && patientRepository.existsByNationalId(nationalId)) {
            throw new ConflictException("NATIONAL_ID_EXISTS");
        }

        Patient patient = new Patient();
        apply(patient, dto, nationalId);

        Patient saved = patientRepository.save(patient);
        log.info("Patient {} created", saved.getId());
        return toDto(saved);
    }

    @Transactional(readOnly = true)
    public PatientDto get(Integer id) {
        return toDto(findPatient(id));
    }

    /**
     * Paged listing with optional contains-filters on name, phone and email, and exact gender.
     */
    @Transactional(readOnly = true)
    public PaginationResponse<PatientDto> filter(String name, String phone, String email, Gender gender, Pageable pageable) {
        Specification<Patient> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (StringUtils.hasText(name)) {
                String like = "%" + name.trim().toLowerCase() + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("firstName")), like),
                        cb.like(cb.lower(root.get("lastName")), like)));
            }
            if (StringUtils.hasText(phone))
                predicates.add(cb.like(root.get("phone"), "%" + phone.trim() + "%"));
            if (StringUtils.hasText(email))
                predicates.add(cb.like(cb.lower(root.get("email")), "%" + email.trim().toLowerCase() + "%"));
            if (gender != null)
                predicates.add(cb.equal(root.get("gender"), gender));

            return cb.and(predicates.toArray(new Predicate[0]));
        };

        return PaginationResponse.fromPage(patientRepository.findAll(spec, pageable), this::toDto);
    }

    @Transactional(readOnly = true)
    public List<PatientDto> searchByName(String name) {
        if (!StringUtils.hasText(name)) return List.of();
        return patientRepository.searchByName(name.trim())
                .stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    public PatientDto update(Integer id, PatientRequestDto dto) {
        Patient patient = findPatient(id);
        String nationalId = trimToNull(dto.getNationalId());
        if (nationalId != null && patientRepository.existsByNationalIdAndIdNot(nationalId, id)) {
            throw new ConflictException("NATIONAL_ID_EXISTS");
        }

        apply(patient, dto, nationalId);
        return toDto(patientRepository.save(patient));
    }

    /**
     * Refused while appointments or invoices reference the patient. Care-team links go with it.
     */
    public void delete(Integer id) {
        Patient patient = findPatient(id);
        if (appointmentRepository.existsByPatient_Id(id) || invoiceRepository.existsByPatient_Id(id)) {
            throw new ConflictException("PATIENT_IN_USE", Map.of("id", id));
        }
        patientRepository.delete(patient);
        log.info("Patient {} deleted", id);
    }

    private Patient findPatient(Integer id) {
        return patientRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("PATIENT_NOT_FOUND", Map.of("id", id)));
    }

    private void apply(Patient p, PatientRequestDto dto, String nationalId) {
        p.setFirstName(dto.getFirstName().trim());
        p.setLastName(dto.getLastName().trim());
        p.setNationalId(nationalId);
        p.setDateOfBirth(dto.getDateOfBirth());
        p.setGender(dto.getGender() != null ? dto.getGender() : Gender.OTHER);
        p.setPhone(trimToNull(dto.getPhone()));
        p.setEmail(dto.getEmail() == null || dto.getEmail().isBlank() ? null : dto.getEmail().trim().toLowerCase());
        p.setAddress(dto.getAddress());
        p.setEmergencyContactName(trimToNull(dto.getEmergencyContactName()));
        p.setEmergencyContactPhone(trimToNull(dto.getEmergencyContactPhone()));
    }

    private static String trimToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private PatientDto toDto(Patient p) {
        return PatientDto.builder()
                .id(p.getId())
                .firstName(p.getFirstName())
                .lastName(p.getLastName())
                .fullName(p.getFullName())
                .nationalId(p.getNationalId())
                .dateOfBirth(p.getDateOfBirth())
                .gender(p.getGender())
                .phone(p.getPhone())
                .email(p.getEmail())
                .address(p.getAddress())
                .emergencyContactName(p.getEmergencyContactName())
                .emergencyContactPhone(p.getEmergencyContactPhone())
                .createdAt(p.getCreatedAt())
                .updatedAt(p.getUpdatedAt())
                .build();
    }
}
