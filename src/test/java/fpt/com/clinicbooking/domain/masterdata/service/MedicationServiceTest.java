package fpt.com.clinicbooking.domain.masterdata.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.domain.masterdata.dto.MedicationDto;
import fpt.com.clinicbooking.domain.masterdata.dto.MedicationRequestDto;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicationRepository;
import fpt.com.clinicbooking.domain.prescription.repository.PrescriptionItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MedicationServiceTest {

    private MedicationRepository repository;
    private PrescriptionItemRepository prescriptionItemRepository;
    private MedicationService service;

    @BeforeEach
    void setUp() {
        repository = mock(MedicationRepository.class);
        prescriptionItemRepository = mock(PrescriptionItemRepository.class);
        service = new MedicationService(repository, prescriptionItemRepository);
        when(repository.save(any(Medication.class))).thenAnswer(inv -> {
            Medication m = inv.getArgument(0);
            if (m.getId() == null) m.setId(21);
            return m;
        });
    }

    @Test
    void create_allowsSameNameWithDifferentStrength() {
        when(repository.findByNameIgnoreCase("Amoxicillin"))
                .thenReturn(List.of(Medication.builder().id(1).name("Amoxicillin").strength("250 mg").build()));

        MedicationDto dto = service.create(MedicationRequestDto.builder()
                .name("Amoxicillin").strength("500 mg").unit("capsule").build());

        assertEquals(21, dto.getId());
        assertEquals("500 mg", dto.getStrength());
    }

    @Test
    void create_conflicts_onSameNameAndStrength() {
        when(repository.findByNameIgnoreCase("Amoxicillin"))
                .thenReturn(List.of(Medication.builder().id(1).name("Amoxicillin").strength("500 mg").build()));

        ConflictException ex = assertThrows(ConflictException.class, () -> service.create(
                MedicationRequestDto.builder().name(" Amoxicillin ").strength("500 MG").build()));

        assertEquals("MEDICATION_EXISTS", ex.getCode());
    }

    @Test
    void create_conflicts_whenBothHaveNoStrength() {
        when(repository.findByNameIgnoreCase("Saline"))
                .thenReturn(List.of(Medication.builder().id(1).name("Saline").build()));

        assertThrows(ConflictException.class,
                () -> service.create(MedicationRequestDto.builder().name("Saline").strength(" ").build()));
    }

    @Test
    void update_ignoresItself_whenCheckingUniqueness() {
        Medication self = Medication.builder().id(1).name("Saline").strength("0.9%").build();
        when(repository.findById(1)).thenReturn(Optional.of(self));
        when(repository.findByNameIgnoreCase("Saline")).thenReturn(List.of(self));

        MedicationDto dto = service.update(1, MedicationRequestDto.builder()
                .name("Saline").strength("0.9%").manufacturer("B. Braun").build());

        assertEquals("B. Braun", dto.getManufacturer());
    }

    @Test
    void delete_refused_whenPrescribed() {
        when(repository.findById(1)).thenReturn(Optional.of(Medication.builder().id(1).name("Saline").build()));
        when(prescriptionItemRepository.existsByMedication_Id(1)).thenReturn(true);

        ConflictException ex = assertThrows(ConflictException.class, () -> service.delete(1));

        assertEquals("MEDICATION_IN_USE", ex.getCode());
        verify(repository, never()).delete(any(Medication.class));
    }
}
