package fpt.com.clinicbooking.domain.prescription.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.appointment.entity.Appointment;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import fpt.com.clinicbooking.domain.doctor.repository.DoctorRepository;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicationRepository;
import fpt.com.clinicbooking.domain.patient.entity.Patient;
import fpt.com.clinicbooking.domain.prescription.dto.PrescriptionCreateDto;
import fpt.com.clinicbooking.domain.prescription.dto.PrescriptionDto;
import fpt.com.clinicbooking.domain.prescription.dto.PrescriptionItemRequestDto;
import fpt.com.clinicbooking.domain.prescription.entity.Prescription;
import fpt.com.clinicbooking.domain.prescription.repository.PrescriptionItemRepository;
import fpt.com.clinicbooking.domain.prescription.repository.PrescriptionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PrescriptionServiceTest {

    private PrescriptionRepository prescriptionRepository;
    private AppointmentRepository appointmentRepository;
    private DoctorRepository doctorRepository;
    private MedicationRepository medicationRepository;
    private PrescriptionService service;

    private Appointment appointment;
    private Doctor attending;

    @BeforeEach
    void setUp() {
        prescriptionRepository = mock(PrescriptionRepository.class);
        appointmentRepository = mock(AppointmentRepository.class);
        doctorRepository = mock(DoctorRepository.class);
        medicationRepository = mock(MedicationRepository.class);
        service = new PrescriptionService(prescriptionRepository, mock(PrescriptionItemRepository.class),
                appointmentRepository, doctorRepository, medicationRepository);

        attending = Doctor.builder().id(2).firstName("Minh").lastName("Le").build();
        appointment = Appointment.builder().id(50)
                .patient(Patient.builder().id(1).firstName("Lan").lastName("Tran").build())
                .doctor(attending)
                .build();
        when(appointmentRepository.findById(50)).thenReturn(Optional.of(appointment));
        when(medicationRepository.findById(4))
                .thenReturn(Optional.of(Medication.builder().id(4).name("Amoxicillin").strength("500 mg").build()));
        when(prescriptionRepository.save(any(Prescription.class))).thenAnswer(inv -> {
            Prescription p = inv.getArgument(0);
            if (p.getId() == null) p.setId(70);
            return p;
        });
    }

    @Test
    void create_defaultsPrescriberToAppointmentDoctor() {
        PrescriptionDto dto = service.create(PrescriptionCreateDto.builder()
                .appointmentId(50)
                .notes("after meals")
                .items(List.of(PrescriptionItemRequestDto.builder()
                        .medicationId(4).dosage(" 1 capsule ").frequency("3x daily").durationDays(7).build()))
                .build());

        assertEquals(70, dto.getId());
        assertEquals(2, dto.getPrescribedById());
        assertEquals(1, dto.getPatientId());
        assertEquals(1, dto.getItems().size());
        assertEquals("1 capsule", dto.getItems().get(0).getDosage());
        assertEquals("Amoxicillin", dto.getItems().get(0).getMedicationName());
    }

    @Test
    void create_usesExplicitPrescriber() {
        when(doctorRepository.findById(3))
                .thenReturn(Optional.of(Doctor.builder().id(3).firstName("Hoa").lastName("Pham").build()));

        PrescriptionDto dto = service.create(PrescriptionCreateDto.builder()
                .appointmentId(50).prescribedById(3).build());

        assertEquals(3, dto.getPrescribedById());
        assertEquals("Hoa Pham", dto.getPrescribedByName());
    }

    @Test
    void create_conflicts_whenAppointmentAlreadyHasPrescription() {
        when(prescriptionRepository.existsByAppointment_Id(50)).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class,
                () -> service.create(PrescriptionCreateDto.builder().appointmentId(50).build()));

        assertEquals("PRESCRIPTION_EXISTS", ex.getCode());
        verify(prescriptionRepository, never()).save(any());
    }

    @Test
    void getByAppointment_throwsNotFound_whenNoneWritten() {
        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.getByAppointment(50));
        assertEquals("PRESCRIPTION_NOT_FOUND", ex.getCode());
    }
}
