package fpt.com.clinicbooking.domain.patient.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.invoice.repository.InvoiceRepository;
import fpt.com.clinicbooking.domain.patient.dto.PatientDto;
import fpt.com.clinicbooking.domain.patient.dto.PatientRequestDto;
import fpt.com.clinicbooking.domain.patient.entity.Gender;
import fpt.com.clinicbooking.domain.patient.entity.Patient;
import fpt.com.clinicbooking.domain.patient.repository.PatientRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PatientServiceTest {

    private PatientRepository patientRepository;
    private AppointmentRepository appointmentRepository;
    private InvoiceRepository invoiceRepository;
    private PatientService service;

    @BeforeEach
    void setUp() {
        patientRepository = mock(PatientRepository.class);
        appointmentRepository = mock(AppointmentRepository.class);
        invoiceRepository = mock(InvoiceRepository.class);
        service = new PatientService(patientRepository, appointmentRepository, invoiceRepository);
        when(patientRepository.save(any(Patient.class))).thenAnswer(inv -> {
            Patient p = inv.getArgument(0);
            if (p.getId() == null) p.setId(12);
            return p;
        });
    }

    @Test
    void create_defaultsGenderToOther_andNormalizesContactFields() {
        PatientDto dto = service.create(PatientRequestDto.builder()
                .firstName("  Lan ")
                .lastName("Tran")
                .nationalId(" ")
                .email(" Lan.Tran@Example.com ")
                .phone("")
                .build());

        assertEquals(12, dto.getId());
        assertEquals("Lan", dto.getFirstName());
        assertEquals("Lan Tran", dto.getFullName());
        assertEquals(Gender.OTHER, dto.getGender());
        assertNull(dto.getNationalId());
        assertNull(dto.getPhone());
        assertEquals("lan.tran@example.com", dto.getEmail());
        verify(patientRepository, never()).existsByNationalId(any());
    }

    @Test
    void create_conflicts_whenNationalIdTaken() {
        when(patientRepository.existsByNationalId("079123")).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class, () -> service.create(PatientRequestDto.builder()
                .firstName("Lan").lastName("Tran").nationalId("079123").build()));

        assertEquals("NATIONAL_ID_EXISTS", ex.getCode());
    }

    @Test
    void update_allowsKeepingOwnNationalId() {
        Patient existing = Patient.builder().id(12).firstName("Lan").lastName("Tran").nationalId("079123").build();
        when(patientRepository.findById(12)).thenReturn(Optional.of(existing));
        when(patientRepository.existsByNationalIdAndIdNot("079123", 12)).thenReturn(false);

        PatientDto dto = service.update(12, PatientRequestDto.builder()
                .firstName("Lan").lastName("Nguyen").nationalId("079123").gender(Gender.FEMALE).build());

        assertEquals("Nguyen", dto.getLastName());
        assertEquals(Gender.FEMALE, dto.getGender());
    }

    @Test
    void delete_refused_whenPatientHasInvoices() {
        when(patientRepository.findById(12)).thenReturn(Optional.of(Patient.builder().id(12).build()));
        when(invoiceRepository.existsByPatient_Id(12)).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class, () -> service.delete(12));

        assertEquals("PATIENT_IN_USE", ex.getCode());
        verify(patientRepository, never()).delete(any(Patient.class));
    }

    @Test
    void delete_removesUnreferencedPatient() {
        Patient patient = Patient.builder().id(12).build();
        when(patientRepository.findById(12)).thenReturn(Optional.of(patient));

        service.delete(12);

        verify(patientRepository).delete(patient);
    }

    @Test
    void get_throwsNotFound_forUnknownId() {
        NotFoundException ex = assertThrows(NotFoundException.class, () -> service.get(404));
        assertEquals("PATIENT_NOT_FOUND", ex.getCode());
    }

    @Test
    void searchByName_returnsEmpty_forBlankQuery() {
        assertTrue(service.searchByName("   ").isEmpty());
        verify(patientRepository, never()).searchByName(any());
    }

    @Test
    void searchByName_trimsQuery() {
        when(patientRepository.searchByName("tran"))
                .thenReturn(List.of(Patient.builder().id(3).firstName("Lan").lastName("Tran").build()));

        List<PatientDto> result = service.searchByName(" tran ");

        assertEquals(1, result.size());
        assertEquals(3, result.get(0).getId());
    }
}
