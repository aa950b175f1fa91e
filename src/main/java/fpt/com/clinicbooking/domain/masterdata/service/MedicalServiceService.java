package fpt.com.clinicbooking.domain.masterdata.service;

import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.MoneyUtil;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentServiceItemRepository;
import fpt.com.clinicbooking.domain.masterdata.dto.MedicalServiceDto;
import fpt.com.clinicbooking.domain.masterdata.dto.MedicalServiceRequestDto;
import fpt.com.clinicbooking.domain.masterdata.entity.MedicalService;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicalServiceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Catalog of billable services. Appointment lines copy the price at booking time,
 * so changing a price here never rewrites history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class MedicalServiceService {

    private final MedicalServiceRepository repository;
    private final AppointmentServiceItemRepository appointmentServiceItemRepository;

    @Transactional(readOnly = true)
    public List<MedicalServiceDto> getAll(String name) {
        List<MedicalService> services = (name == null || name.isBlank())
                ? repository.findAll(Sort.by("name"))
                : repository.findByNameContainingIgnoreCaseOrderByNameAsc(name.trim());
        return services.stream().map(this::toDto).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public MedicalServiceDto get(Integer id) {
        return toDto(findService(id));
    }

    @Transactional(readOnly = true)
    public MedicalServiceDto getByCode(String code) {
        return repository.findByCodeIgnoreCase(code.trim())
                .map(this::toDto)
                .orElseThrow(() -> new NotFoundException("SERVICE_NOT_FOUND", Map.of("code", code)));
    }

    public MedicalServiceDto create(MedicalServiceRequestDto dto) {
        String code = dto.getCode().trim().toUpperCase();
        if (repository.existsByCodeIgnoreCase(code)) throw new ConflictException("SERVICE_CODE_EXISTS");

        MedicalService service = MedicalService.builder()
                .code(code)
                .name(dto.getName().trim())
                .description(dto.getDescription())
                .build();
        if (dto.getPrice() != null) service.setPrice(MoneyUtil.normalize(dto.getPrice()));
        if (dto.getDurationMinutes() != null) service.setDurationMinutes(dto.getDurationMinutes());

        MedicalService saved = repository.save(service);
        log.info("Service {} ({}) created", saved.getId(), saved.getCode());
        return toDto(saved);
    }

    public MedicalServiceDto update(Integer id, MedicalServiceRequestDto dto) {
        MedicalService service = findService(id);
        String code = dto.getCode().trim().toUpperCase();
        if (repository.existsByCodeIgnoreCaseAndIdNot(code, id)) throw new ConflictException("SERVICE_CODE_EXISTS");

        service.setCode(code);
        service.setName(dto.getName().trim());
        service.setDescription(dto.getDescription());
        if (dto.getPrice() != null) service.setPrice(MoneyUtil.normalize(dto.getPrice()));
        if (dto.getDurationMinutes() != null) service.setDurationMinutes(dto.getDurationMinutes());
        return toDto(repository.save(service));
    }

    public void delete(Integer id) {
        MedicalService service = findService(id);
        if (appointmentServiceItemRepository.existsByService_Id(id)) {
            throw new ConflictException("SERVICE_IN_USE", Map.of("id", id));
        }
        repository.delete(service);
        log.info("Service {} deleted", id);
    }

    private MedicalService findService(Integer id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("SERVICE_NOT_FOUND", Map.of("id", id)));
    }

    private MedicalServiceDto toDto(MedicalService e) {
        return new MedicalServiceDto(
                e.getId(),
                e.getCode(),
                e.getName(),
                e.getDescription(),
                e.getPrice(),
                e.getDurationMinutes(),
                e.getCreatedAt()
        );
    }
}
