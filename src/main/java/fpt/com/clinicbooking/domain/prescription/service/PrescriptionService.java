package fpt.com.clinicbooking.domain.prescription.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.appointment.entity.Appointment;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import fpt.com.clinicbooking.domain.doctor.repository.DoctorRepository;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicationRepository;
import fpt.com.clinicbooking.domain.prescription.dto.*;
import fpt.com.clinicbooking.domain.prescription.entity.Prescription;
import fpt.com.clinicbooking.domain.prescription.entity.PrescriptionItem;
import fpt.com.clinicbooking.domain.prescription.repository.PrescriptionItemRepository;
import fpt.com.clinicbooking.domain.prescription.repository.PrescriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class PrescriptionService {

    private final PrescriptionRepository prescriptionRepository;
    private final PrescriptionItemRepository itemRepository;
    private final AppointmentRepository appointmentRepository;
    private final DoctorRepository doctorRepository;
    private final MedicationRepository medicationRepository;

    /**
     * One prescription per appointment, written together with its items.
     */
    public PrescriptionDto create(PrescriptionCreateDto dto) {
        Appointment appointment = appointmentRepository.findById(dto.getAppointmentId())
                .orElseThrow(() -> new NotFoundException("APPOINTMENT_NOT_FOUND", Map.of("id", dto.getAppointmentId())));
        if (prescriptionRepository.existsByAppointment_Id(appointment.getId())) {
            throw new ConflictException("PRESCRIPTION_EXISTS", Map.of("appointmentId", appointment.getId()));
        }

        Doctor doctor = dto.getPrescribedById() != null
                ? doctorRepository.findById(dto.getPrescribedById())
                    .orElseThrow(() -> new NotFoundException("DOCTOR_NOT_FOUND", Map.of("id", dto.getPrescribedById())))
                : appointment.getDoctor();

        Prescription prescription = Prescription.builder()
                .appointment(appointment)
                .prescribedBy(doctor)
                .notes(dto.getNotes())
                .build();
        if (dto.getItems() != null) {
            dto.getItems().forEach(i -> prescription.addItem(buildItem(i)));
        }

        Prescription saved = prescriptionRepository.save(prescription);
        log.info("Prescription {} written for appointment {} ({} items)",
                saved.getId(), appointment.getId(), saved.getItems().size());
        return toDto(saved);
    }

    @Transactional(readOnly = true)
    public PrescriptionDto get(Integer id) {
        return toDto(findPrescription(id));
    }

    @Transactional(readOnly = true)
    public PrescriptionDto getByAppointment(Integer appointmentId) {
        return prescriptionRepository.findByAppointment_Id(appointmentId)
                .map(this::toDto)
                .orElseThrow(() -> new NotFoundException("PRESCRIPTION_NOT_FOUND", Map.of("appointmentId", appointmentId)));
    }

    public PrescriptionDto updateNotes(Integer id, String notes) {
        Prescription prescription = findPrescription(id);
        prescription.setNotes(notes);
        return toDto(prescriptionRepository.save(prescription));
    }

    public PrescriptionDto addItem(Integer id, PrescriptionItemRequestDto dto) {
        Prescription prescription = findPrescription(id);
        PrescriptionItem item = buildItem(dto);
        prescription.addItem(item);
        itemRepository.save(item);
        log.info("Medication {} added to prescription {}", dto.getMedicationId(), id);
        return toDto(prescription);
    }

    public PrescriptionDto removeItem(Integer id, Integer itemId) {
        Prescription prescription = findPrescription(id);
        PrescriptionItem item = prescription.getItems().stream()
                .filter(i -> i.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("PRESCRIPTION_ITEM_NOT_FOUND",
                        Map.of("prescriptionId", id, "itemId", itemId)));
        prescription.getItems().remove(item);
        return toDto(prescription);
    }

    public void delete(Integer id) {
        prescriptionRepository.delete(findPrescription(id));
        log.info("Prescription {} deleted", id);
    }

    private PrescriptionItem buildItem(PrescriptionItemRequestDto dto) {
        Medication medication = medicationRepository.findById(dto.getMedicationId())
                .orElseThrow(() -> new NotFoundException("MEDICATION_NOT_FOUND", Map.of("id", dto.getMedicationId())));
        return PrescriptionItem.builder()
                .medication(medication)
                .dosage(dto.getDosage().trim())
                .frequency(dto.getFrequency().trim())
                .durationDays(dto.getDurationDays())
                .instructions(dto.getInstructions())
                .build();
    }

    private Prescription findPrescription(Integer id) {
        return prescriptionRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("PRESCRIPTION_NOT_FOUND", Map.of("id", id)));
    }

    private PrescriptionDto toDto(Prescription p) {
        List<PrescriptionItemDto> items = p.getItems().stream()
                .map(i -> new PrescriptionItemDto(
                        i.getId(),
                        i.getMedication().getId(),
                        i.getMedication().getName(),
                        i.getMedication().getStrength(),
                        i.getDosage(),
                        i.getFrequency(),
                        i.getDurationDays(),
                        i.getInstructions()))
                .collect(Collectors.toList());

        return PrescriptionDto.builder()
                .id(p.getId())
                .appointmentId(p.getAppointment().getId())
                .patientId(p.getAppointment().getPatient().getId())
                .prescribedById(p.getPrescribedBy().getId())
                .prescribedByName(p.getPrescribedBy().getFullName())
                .notes(p.getNotes())
                .items(items)
                .createdAt(p.getCreatedAt())
                .build();
    }
}
