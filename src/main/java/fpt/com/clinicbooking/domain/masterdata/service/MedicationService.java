package fpt.com.clinicbooking.domain.masterdata.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.masterdata.dto.MedicationDto;
import fpt.com.clinicbooking.domain.masterdata.dto.MedicationRequestDto;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicationRepository;
import fpt.com.clinicbooking.domain.prescription.repository.PrescriptionItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class MedicationService {

    private final MedicationRepository repository;
    private final PrescriptionItemRepository prescriptionItemRepository;

    @Transactional(readOnly = true)
    public List<MedicationDto> getAll(String name) {
        List<Medication> medications = (name == null || name.isBlank())
                ? repository.findAll(Sort.by("name", "strength"))
                : repository.findByNameContainingIgnoreCaseOrderByNameAsc(name.trim());
        return medications.stream().map(this::toDto).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public MedicationDto get(Integer id) {
        return toDto(findMedication(id));
    }

    public MedicationDto create(MedicationRequestDto dto) {
        String name = dto.getName().trim();
        String strength = trimToNull(dto.getStrength());
        ensureUnique(name, strength, null);

        Medication saved = repository.save(Medication.builder()
                .name(name)
                .manufacturer(trimToNull(dto.getManufacturer()))
                .unit(trimToNull(dto.getUnit()))
                .strength(strength)
                .build());
        log.info("Medication {} created", saved.getId());
        return toDto(saved);
    }

    public MedicationDto update(Integer id, MedicationRequestDto dto) {
        Medication medication = findMedication(id);
        String name = dto.getName().trim();
        String strength = trimToNull(dto.getStrength());
        ensureUnique(name, strength, id);

        medication.setName(name);
        medication.setStrength(strength);
        medication.setManufacturer(trimToNull(dto.getManufacturer()));
        medication.setUnit(trimToNull(dto.getUnit()));
        return toDto(repository.save(medication));
    }

    /**
     * Refused while prescriptions use the medication. Its inventory row is removed with it
     * and invoice items keep their text but lose the reference.
     */
    public void delete(Integer id) {
        Medication medication = findMedication(id);
        if (prescriptionItemRepository.existsByMedication_Id(id)) {
            throw new ConflictException("MEDICATION_IN_USE", Map.of("id", id));
        }
        repository.delete(medication);
        log.info("Medication {} deleted", id);
    }

    // (name, strength) is unique; two rows without strength count as duplicates here
    private void ensureUnique(String name, String strength, Integer selfId) {
        boolean taken = repository.findByNameIgnoreCase(name).stream()
                .filter(m -> selfId == null || !m.getId().equals(selfId))
                .anyMatch(m -> strength == null
                        ? m.getStrength() == null
                        : strength.equalsIgnoreCase(m.getStrength()));
        if (taken) throw new ConflictException("MEDICATION_EXISTS");
    }

    private Medication findMedication(Integer id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("MEDICATION_NOT_FOUND", Map.of("id", id)));
    }

    private static String trimToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private MedicationDto toDto(Medication e) {
        return new MedicationDto(
                e.getId(),
                e.getName(),
                e.getManufacturer(),
                e.getUnit(),
                e.getStrength(),
                e.getCreatedAt()
        );
    }
}
