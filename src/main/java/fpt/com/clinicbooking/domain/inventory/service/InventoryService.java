package fpt.com.clinicbooking.domain.inventory.service;

import fpt.com.clinicbooking.common.exception.BusinessException;
import fpt.com.clinicbooking.common.exception.ConflictException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.inventory.dto.InventoryCreateDto;
import fpt.com.clinicbooking.domain.inventory.dto.InventoryDto;
import fpt.com.clinicbooking.domain.inventory.entity.Inventory;
import fpt.com.clinicbooking.domain.inventory.repository.InventoryRepository;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class InventoryService {

    private final InventoryRepository inventoryRepository;
    private final MedicationRepository medicationRepository;

    public InventoryDto create(InventoryCreateDto dto) {
        Medication medication = medicationRepository.findById(dto.getMedicationId())
                .orElseThrow(() -> new NotFoundException("MEDICATION_NOT_FOUND", Map.of("id", dto.getMedicationId())));
        if (inventoryRepository.existsByMedication_Id(medication.getId())) {
            throw new ConflictException("INVENTORY_EXISTS", Map.of("medicationId", medication.getId()));
        }

        Inventory inventory = Inventory.builder()
                .medication(medication)
                .quantityOnHand(dto.getQuantityOnHand() != null ? dto.getQuantityOnHand() : 0)
                .reorderLevel(dto.getReorderLevel() != null ? dto.getReorderLevel() : 0)
                .lastRestock(dto.getLastRestock())
                .build();

        Inventory saved = inventoryRepository.save(inventory);
        log.info("Inventory {} opened for medication {} with {} on hand",
                saved.getId(), medication.getId(), saved.getQuantityOnHand());
        return toDto(saved);
    }

    @Transactional(readOnly = true)
    public InventoryDto get(Integer id) {
        return toDto(findInventory(id));
    }

    @Transactional(readOnly = true)
    public InventoryDto getByMedication(Integer medicationId) {
        return inventoryRepository.findByMedication_Id(medicationId)
                .map(this::toDto)
                .orElseThrow(() -> new NotFoundException("INVENTORY_NOT_FOUND", Map.of("medicationId", medicationId)));
    }

    @Transactional(readOnly = true)
    public PaginationResponse<InventoryDto> getAll(Pageable pageable) {
        return PaginationResponse.fromPage(inventoryRepository.findAll(pageable), this::toDto);
    }

    /**
     * Rows at or below their reorder level.
     */
    @Transactional(readOnly = true)
    public List<InventoryDto> getLowStock() {
        return inventoryRepository.findLowStock()
                .stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    public InventoryDto updateReorderLevel(Integer id, int reorderLevel) {
        Inventory inventory = findInventory(id);
        inventory.setReorderLevel(reorderLevel);
        return toDto(inventoryRepository.save(inventory));
    }

    public InventoryDto restock(Integer id, int quantity, LocalDate date) {
        Inventory inventory = findInventory(id);
        int onHand;
        try {
            onHand = Math.addExact(inventory.getQuantityOnHand(), quantity);
        } catch (ArithmeticException ex) {
            throw new BusinessException("STOCK_OVERFLOW",
                    Map.of("id", id, "onHand", inventory.getQuantityOnHand(), "requested", quantity));
        }
        inventory.setQuantityOnHand(onHand);
        inventory.setLastRestock(date != null ? date : LocalDate.now());
        log.info("Inventory {} restocked by {} to {}", id, quantity, inventory.getQuantityOnHand());
        return toDto(inventoryRepository.save(inventory));
    }

    public InventoryDto deduct(Integer id, int quantity) {
        Inventory inventory = findInventory(id);
        if (quantity > inventory.getQuantityOnHand()) {
            throw new BusinessException("INSUFFICIENT_STOCK",
                    Map.of("id", id, "onHand", inventory.getQuantityOnHand(), "requested", quantity));
        }
        inventory.setQuantityOnHand(inventory.getQuantityOnHand() - quantity);
        if (inventory.isLowStock()) {
            log.warn("Inventory {} at or below reorder level ({} <= {})",
                    id, inventory.getQuantityOnHand(), inventory.getReorderLevel());
        }
        return toDto(inventoryRepository.save(inventory));
    }

    private Inventory findInventory(Integer id) {
        return inventoryRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("INVENTORY_NOT_FOUND", Map.of("id", id)));
    }

    private InventoryDto toDto(Inventory i) {
        Medication m = i.getMedication();
        return new InventoryDto(
                i.getId(),
                m.getId(),
                m.getName(),
                m.getStrength(),
                i.getQuantityOnHand(),
                i.getReorderLevel(),
                i.getLastRestock(),
                i.isLowStock()
        );
    }
}
