package fpt.com.clinicbooking.domain.masterdata.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.domain.masterdata.dto.SpecialtyDto;
import fpt.com.clinicbooking.domain.masterdata.dto.SpecialtyRequestDto;
import fpt.com.clinicbooking.domain.masterdata.entity.Specialty;
import fpt.com.clinicbooking.domain.masterdata.repository.SpecialtyRepository;
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
public class SpecialtyService {

    private final SpecialtyRepository repository;

    @Transactional(readOnly = true)
    public List<SpecialtyDto> getAll() {
        return repository.findAll(Sort.by("name"))
                .stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SpecialtyDto get(Integer id) {
        return toDto(findSpecialty(id));
    }

    public SpecialtyDto create(SpecialtyRequestDto dto) {
        String name = dto.getName().trim();
        if (repository.existsByNameIgnoreCase(name)) throw new ConflictException("SPECIALTY_EXISTS");

        Specialty saved = repository.save(Specialty.builder()
                .name(name)
                .description(dto.getDescription())
                .build());
        log.info("Specialty {} created", saved.getId());
        return toDto(saved);
    }

    public SpecialtyDto update(Integer id, SpecialtyRequestDto dto) {
        Specialty specialty = findSpecialty(id);
        String name = dto.getName().trim();
        if (repository.existsByNameIgnoreCaseAndIdNot(name, id)) throw new ConflictException("SPECIALTY_EXISTS");

        specialty.setName(name);
        specialty.setDescription(dto.getDescription());
        return toDto(repository.save(specialty));
    }

    /**
     * Doctor links to the specialty go away with it (ON DELETE CASCADE).
     */
    public void delete(Integer id) {
        repository.delete(findSpecialty(id));
        log.info("Specialty {} deleted", id);
    }

    private Specialty findSpecialty(Integer id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("SPECIALTY_NOT_FOUND", Map.of("id", id)));
    }

    private SpecialtyDto toDto(Specialty e) {
        return new SpecialtyDto(e.getId(), e.getName(), e.getDescription());
    }
}
