package fpt.com.clinicbooking.domain.appointment.service;

import fpt.com.clinicbooking.common.exception.BadRequestException;
import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.MoneyUtil;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.appointment.dto.*;
import fpt.com.clinicbooking.domain.appointment.entity.Appointment;
import fpt.com.clinicbooking.domain.appointment.entity.AppointmentServiceItem;
import fpt.com.clinicbooking.domain.appointment.entity.AppointmentServiceItemId;
import fpt.com.clinicbooking.domain.appointment.entity.AppointmentStatus;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import fpt.com.clinicbooking.domain.doctor.repository.DoctorRepository;
import fpt.com.clinicbooking.domain.masterdata.entity.MedicalService;
import fpt.com.clinicbooking.domain.masterdata.entity.Room;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicalServiceRepository;
import fpt.com.clinicbooking.domain.masterdata.repository.RoomRepository;
import fpt.com.clinicbooking.domain.patient.entity.Patient;
import fpt.com.clinicbooking.domain.patient.repository.PatientRepository;
import fpt.com.clinicbooking.domain.user.dto.UserSummaryDto;
import fpt.com.clinicbooking.domain.user.entity.User;
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Booking of appointments and their service lines. No overlap check is made between
 * appointments of the same doctor, patient or room.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class AppointmentService {

    private final AppointmentRepository appointmentRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final RoomRepository roomRepository;
    private final UserRepository userRepository;
    private final MedicalServiceRepository medicalServiceRepository;

    // ===================================================================================
    // CREATE (appointment + lines in one transaction)
    // ===================================================================================
    public AppointmentDto create(AppointmentCreateDto dto) {
        validateSchedule(dto.getScheduledStart(), dto.getScheduledEnd());

        Patient patient = patientRepository.findById(dto.getPatientId())
                .orElseThrow(() -> new NotFoundException("PATIENT_NOT_FOUND", Map.of("id", dto.getPatientId())));
        Doctor doctor = findDoctor(dto.getDoctorId());

        Appointment appointment = Appointment.builder()
                .patient(patient)
                .doctor(doctor)
                .room(dto.getRoomId() != null ? findRoom(dto.getRoomId()) : null)
                .createdBy(dto.getCreatedById() != null ? findUser(dto.getCreatedById()) : null)
                .scheduledStart(dto.getScheduledStart())
                .scheduledEnd(dto.getScheduledEnd())
                .status(AppointmentStatus.SCHEDULED)
                .reason(dto.getReason())
                .build();

        Set<Integer> seen = new HashSet<>();
        for (AppointmentServiceLineDto line : dto.getServices() == null ? List.<AppointmentServiceLineDto>of() : dto.getServices()) {
            if (!seen.add(line.getServiceId())) {
                throw new BadRequestException("DUPLICATE_SERVICE_LINE", Map.of("serviceId", line.getServiceId()));
            }
            appointment.addService(buildLine(line));
        }

        Appointment saved = appointmentRepository.save(appointment);
        log.info("Appointment {} booked for patient {} with doctor {} ({} service lines)",
                saved.getId(), patient.getId(), doctor.getId(), saved.getServices().size());
        return toDto(saved);
    }

    // ===================================================================================
    // READ
    // ===================================================================================
    @Transactional(readOnly = true)
    public AppointmentDto get(Integer id) {
        return toDto(findAppointment(id));
    }

    /**
     * Filters are optional; {@code from} is inclusive and {@code to} exclusive, both on the start time.
     */
    @Transactional(readOnly = true)
    public PaginationResponse<AppointmentDto> filter(Integer patientId, Integer doctorId, Integer roomId,
                                                     AppointmentStatus status, LocalDateTime from, LocalDateTime to,
                                                     Pageable pageable) {
        Specification<Appointment> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (patientId != null) predicates.add(cb.equal(root.get("patient").get("id"), patientId));
            if (doctorId != null) predicates.add(cb.equal(root.get("doctor").get("id"), doctorId));
            if (roomId != null) predicates.add(cb.equal(root.get("room").get("id"), roomId));
            if (status != null) predicates.add(cb.equal(root.get("status"), status));
            if (from != null) predicates.add(cb.greaterThanOrEqualTo(root.get("scheduledStart"), from));
            if (to != null) predicates.add(cb.lessThan(root.get("scheduledStart"), to));
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        return PaginationResponse.fromPage(appointmentRepository.findAll(spec, pageable), this::toDto);
    }

    // ===================================================================================
    // UPDATE
    // ===================================================================================
    public AppointmentDto reschedule(Integer id, AppointmentUpdateDto dto) {
        Appointment appointment = findAppointment(id);
        validateSchedule(dto.getScheduledStart(), dto.getScheduledEnd());

        if (dto.getDoctorId() != null) appointment.setDoctor(findDoctor(dto.getDoctorId()));
        appointment.setRoom(dto.getRoomId() != null ? findRoom(dto.getRoomId()) : null);
        appointment.setScheduledStart(dto.getScheduledStart());
        appointment.setScheduledEnd(dto.getScheduledEnd());
        appointment.setReason(dto.getReason());

        Appointment saved = appointmentRepository.save(appointment);
        log.info("Appointment {} updated: {} - {}", id, saved.getScheduledStart(), saved.getScheduledEnd());
        return toDto(saved);
    }

    // any status may follow any other
    public AppointmentDto changeStatus(Integer id, AppointmentStatus status) {
        Appointment appointment = findAppointment(id);
        AppointmentStatus previous = appointment.getStatus();
        appointment.setStatus(status);
        Appointment saved = appointmentRepository.save(appointment);
        log.info("Appointment {} status {} -> {}", id, previous.getValue(), status.getValue());
        return toDto(saved);
    }

    // ===================================================================================
    // SERVICE LINES
    // ===================================================================================
    public AppointmentDto addService(Integer id, AppointmentServiceLineDto dto) {
        Appointment appointment = findAppointment(id);
        if (findLine(appointment, dto.getServiceId()).isPresent()) {
            throw new ConflictException("APPOINTMENT_SERVICE_EXISTS",
                    Map.of("appointmentId", id, "serviceId", dto.getServiceId()));
        }
        AppointmentServiceItem line = buildLine(dto);
        line.setId(new AppointmentServiceItemId(id, dto.getServiceId()));
        appointment.addService(line);
        // the new line is inserted at flush through the cascade on the collection
        log.info("Service {} added to appointment {}", dto.getServiceId(), id);
        return toDto(appointment);
    }

    public AppointmentDto updateService(Integer id, Integer serviceId, AppointmentServiceLineUpdateDto dto) {
        Appointment appointment = findAppointment(id);
        AppointmentServiceItem line = findLine(appointment, serviceId)
                .orElseThrow(() -> new NotFoundException("APPOINTMENT_SERVICE_NOT_FOUND",
                        Map.of("appointmentId", id, "serviceId", serviceId)));
        if (dto.getQuantity() != null) line.setQuantity(dto.getQuantity());
        if (dto.getUnitPrice() != null) line.setUnitPrice(MoneyUtil.normalize(dto.getUnitPrice()));
        return toDto(appointment);
    }

    public AppointmentDto removeService(Integer id, Integer serviceId) {
        Appointment appointment = findAppointment(id);
        AppointmentServiceItem line = findLine(appointment, serviceId)
                .orElseThrow(() -> new NotFoundException("APPOINTMENT_SERVICE_NOT_FOUND",
                        Map.of("appointmentId", id, "serviceId", serviceId)));
        appointment.getServices().remove(line);
        log.info("Service {} removed from appointment {}", serviceId, id);
        return toDto(appointment);
    }

    // ===================================================================================
    // DELETE
    // ===================================================================================

    /**
     * Lines and the prescription are removed with the appointment; invoices stay and lose the link.
     */
    public void delete(Integer id) {
        Appointment appointment = findAppointment(id);
        appointmentRepository.delete(appointment);
        log.info("Appointment {} deleted", id);
    }

    // ===================================================================================
    // HELPERS
    // ===================================================================================
    private void validateSchedule(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null || !end.isAfter(start)) {
            throw new BadRequestException("INVALID_SCHEDULE");
        }
    }

    private AppointmentServiceItem buildLine(AppointmentServiceLineDto dto) {
        MedicalService service = medicalServiceRepository.findById(dto.getServiceId())
                .orElseThrow(() -> new NotFoundException("SERVICE_NOT_FOUND", Map.of("id", dto.getServiceId())));
        BigDecimal price = dto.getUnitPrice() != null ? dto.getUnitPrice() : service.getPrice();
        return AppointmentServiceItem.builder()
                .service(service)
                .quantity(dto.getQuantity() != null ? dto.getQuantity() : 1)
                .unitPrice(MoneyUtil.normalize(price))
                .build();
    }

    private Optional<AppointmentServiceItem> findLine(Appointment appointment, Integer serviceId) {
        return appointment.getServices().stream()
                .filter(l -> l.getService().getId().equals(serviceId))
                .findFirst();
    }

    private Appointment findAppointment(Integer id) {
        return appointmentRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("APPOINTMENT_NOT_FOUND", Map.of("id", id)));
    }

    private Doctor findDoctor(Integer id) {
        return doctorRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("DOCTOR_NOT_FOUND", Map.of("id", id)));
    }

    private Room findRoom(Integer id) {
        return roomRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("ROOM_NOT_FOUND", Map.of("id", id)));
    }

    private User findUser(Integer id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", Map.of("id", id)));
    }

    private AppointmentDto toDto(Appointment a) {
        List<AppointmentServiceItemDto> lines = a.getServices().stream()
                .map(l -> new AppointmentServiceItemDto(
                        l.getService().getId(),
                        l.getService().getCode(),
                        l.getService().getName(),
                        l.getQuantity(),
                        l.getUnitPrice(),
                        l.getLineTotal()))
                .collect(Collectors.toList());
        BigDecimal total = lines.stream()
                .map(AppointmentServiceItemDto::getLineTotal)
                .reduce(MoneyUtil.ZERO, BigDecimal::add);

        return AppointmentDto.builder()
                .id(a.getId())
                .patientId(a.getPatient().getId())
                .patientName(a.getPatient().getFullName())
                .doctorId(a.getDoctor().getId())
                .doctorName(a.getDoctor().getFullName())
                .roomId(a.getRoom() != null ? a.getRoom().getId() : null)
                .roomName(a.getRoom() != null ? a.getRoom().getName() : null)
                .scheduledStart(a.getScheduledStart())
                .scheduledEnd(a.getScheduledEnd())
                .status(a.getStatus())
                .reason(a.getReason())
                .createdBy(UserSummaryDto.of(a.getCreatedBy()))
                .services(lines)
                .servicesTotal(total)
                .createdAt(a.getCreatedAt())
                .updatedAt(a.getUpdatedAt())
                .build();
    }
}
