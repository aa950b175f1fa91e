package fpt.com.clinicbooking.domain.doctor.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.doctor.dto.DoctorDto;
import fpt.com.clinicbooking.domain.doctor.dto.DoctorRequestDto;
import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import fpt.com.clinicbooking.domain.doctor.entity.DoctorSpecialty;
import fpt.com.clinicbooking.domain.doctor.entity.DoctorSpecialtyId;
import fpt.com.clinicbooking.domain.doctor.repository.DoctorRepository;
import fpt.com.clinicbooking.domain.doctor.repository.DoctorSpecialtyRepository;
import fpt.com.clinicbooking.domain.masterdata.dto.SpecialtyDto;
import fpt.com.clinicbooking.domain.masterdata.entity.Specialty;
import fpt.com.clinicbooking.domain.masterdata.repository.SpecialtyRepository;
import fpt.com.clinicbooking.domain.prescription.repository.PrescriptionRepository;
import fpt.com.clinicbooking.domain.user.dto.UserSummaryDto;
import fpt.com.clinicbooking.domain.user.entity.User;
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class DoctorService {

    private final DoctorRepository doctorRepository;
    private final DoctorSpecialtyRepository doctorSpecialtyRepository;
    private final SpecialtyRepository specialtyRepository;
    private final UserRepository userRepository;
    private final AppointmentRepository appointmentRepository;
    private final PrescriptionRepository prescriptionRepository;

    // ===================================================================================
    // CREATE
    // ===================================================================================
    public DoctorDto create(DoctorRequestDto dto) {
        String license = dto.getLicenseNumber().trim();
        if (doctorRepository.existsByLicenseNumberIgnoreCase(license)) {
            throw new ConflictException("LICENSE_NUMBER_EXISTS");
        }

        Doctor doctor = new Doctor();
        apply(doctor, dto, license);
        if (dto.getUserId() != null) {
            doctor.setUser(findLinkableUser(dto.getUserId(), null));
        }
        Doctor saved = doctorRepository.save(doctor);

        if (dto.getSpecialtyIds() != null) {
            for (Integer specialtyId : new LinkedHashSet<>(dto.getSpecialtyIds())) {
                doctorSpecialtyRepository.save(DoctorSpecialty.builder()
                        .id(new DoctorSpecialtyId(saved.getId(), specialtyId))
                        .doctor(saved)
                        .specialty(findSpecialty(specialtyId))
                        .build());
            }
        }

        log.info("Doctor {} created (license {})", saved.getId(), saved.getLicenseNumber());
        return toDto(saved);
    }

    // ===================================================================================
    // READ
    // ===================================================================================
    @Transactional(readOnly = true)
    public DoctorDto get(Integer id) {
        return toDto(findDoctor(id));
    }

    @Transactional(readOnly = true)
    public PaginationResponse<DoctorDto> search(Integer specialtyId, String name, Pageable pageable) {
        String q = (name == null || name.isBlank()) ? null : name.trim();
        return PaginationResponse.fromPage(doctorRepository.search(specialtyId, q, pageable), this::toDto);
    }

    // ===================================================================================
    // UPDATE
    // ===================================================================================
    public DoctorDto update(Integer id, DoctorRequestDto dto) {
        Doctor doctor = findDoctor(id);
        String license = dto.getLicenseNumber().trim();
        if (doctorRepository.existsByLicenseNumberIgnoreCaseAndIdNot(license, id)) {
            throw new ConflictException("LICENSE_NUMBER_EXISTS");
        }

        apply(doctor, dto, license);
        if (dto.getUserId() != null) {
            doctor.setUser(findLinkableUser(dto.getUserId(), id));
        }
        return toDto(doctorRepository.save(doctor));
    }

    public DoctorDto linkUser(Integer id, Integer userId) {
        Doctor doctor = findDoctor(id);
        doctor.setUser(findLinkableUser(userId, id));
        log.info("Doctor {} linked to user {}", id, userId);
        return toDto(doctorRepository.save(doctor));
    }

    public DoctorDto unlinkUser(Integer id) {
        Doctor doctor = findDoctor(id);
        doctor.setUser(null);
        log.info("Doctor {} unlinked from its user account", id);
        return toDto(doctorRepository.save(doctor));
    }

    // ===================================================================================
    // SPECIALTIES
    // ===================================================================================
    public DoctorDto addSpecialty(Integer id, Integer specialtyId) {
        Doctor doctor = findDoctor(id);
        Specialty specialty = findSpecialty(specialtyId);
        if (doctorSpecialtyRepository.existsById(new DoctorSpecialtyId(id, specialtyId))) {
            throw new ConflictException("DOCTOR_SPECIALTY_EXISTS", Map.of("doctorId", id, "specialtyId", specialtyId));
        }
        // save() merges; the explicit id makes it insert a new row
        doctorSpecialtyRepository.save(DoctorSpecialty.builder()
                .id(new DoctorSpecialtyId(id, specialtyId))
                .doctor(doctor)
                .specialty(specialty)
                .build());
        return toDto(doctor);
    }

    public DoctorDto removeSpecialty(Integer id, Integer specialtyId) {
        Doctor doctor = findDoctor(id);
        DoctorSpecialty link = doctorSpecialtyRepository.findById(new DoctorSpecialtyId(id, specialtyId))
                .orElseThrow(() -> new NotFoundException("DOCTOR_SPECIALTY_NOT_FOUND",
                        Map.of("doctorId", id, "specialtyId", specialtyId)));
        doctorSpecialtyRepository.delete(link);
        doctorSpecialtyRepository.flush();
        return toDto(doctor);
    }

    // ===================================================================================
    // DELETE
    // ===================================================================================

    /**
     * Refused while appointments or prescriptions point at the doctor; specialty links and
     * patient assignments cascade.
     */
    public void delete(Integer id) {
        Doctor doctor = findDoctor(id);
        if (appointmentRepository.existsByDoctor_Id(id) || prescriptionRepository.existsByPrescribedBy_Id(id)) {
            throw new ConflictException("DOCTOR_IN_USE", Map.of("id", id));
        }
        doctorRepository.delete(doctor);
        log.info("Doctor {} deleted", id);
    }

    // ===================================================================================
    // HELPERS
    // ===================================================================================
    private Doctor findDoctor(Integer id) {
        return doctorRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("DOCTOR_NOT_FOUND", Map.of("id", id)));
    }

    private Specialty findSpecialty(Integer id) {
        return specialtyRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("SPECIALTY_NOT_FOUND", Map.of("id", id)));
    }

    // one account per doctor
    private User findLinkableUser(Integer userId, Integer doctorId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", Map.of("id", userId)));
        boolean taken = doctorId == null
                ? doctorRepository.existsByUser_Id(userId)
                : doctorRepository.existsByUser_IdAndIdNot(userId, doctorId);
        if (taken) throw new ConflictException("USER_ALREADY_LINKED", Map.of("userId", userId));
        return user;
    }

    private void apply(Doctor d, DoctorRequestDto dto, String license) {
        d.setFirstName(dto.getFirstName().trim());
        d.setLastName(dto.getLastName().trim());
        d.setPhone(dto.getPhone());
        d.setEmail(dto.getEmail() == null || dto.getEmail().isBlank() ? null : dto.getEmail().trim().toLowerCase());
        d.setLicenseNumber(license);
        d.setHireDate(dto.getHireDate());
    }

    private DoctorDto toDto(Doctor d) {
        List<SpecialtyDto> specialties = d.getId() == null ? List.of() :
                doctorSpecialtyRepository.findByDoctor_Id(d.getId()).stream()
                        .map(DoctorSpecialty::getSpecialty)
                        .sorted(Comparator.comparing(Specialty::getName))
                        .map(s -> new SpecialtyDto(s.getId(), s.getName(), s.getDescription()))
                        .collect(Collectors.toList());

        return DoctorDto.builder()
                .id(d.getId())
                .user(UserSummaryDto.of(d.getUser()))
                .firstName(d.getFirstName())
                .lastName(d.getLastName())
                .fullName(d.getFullName())
                .phone(d.getPhone())
                .email(d.getEmail())
                .licenseNumber(d.getLicenseNumber())
                .hireDate(d.getHireDate())
                .specialties(specialties)
                .createdAt(d.getCreatedAt())
                .updatedAt(d.getUpdatedAt())
                .build();
    }
}
