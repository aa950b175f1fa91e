package fpt.com.clinicbooking.domain.inventory.controller;

import fpt.com.clinicbooking.common.util.PageRequestFactory;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.inventory.dto.InventoryCreateDto;
import fpt.com.clinicbooking.domain.inventory.dto.InventoryDto;
import fpt.com.clinicbooking.domain.inventory.dto.InventoryUpdateDto;
import fpt.com.clinicbooking.domain.inventory.dto.StockMovementDto;
import fpt.com.clinicbooking.domain.inventory.service.InventoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;
    private final PageRequestFactory pageRequestFactory;

    @GetMapping
    public ResponseEntity<PaginationResponse<InventoryDto>> list(@RequestParam(required = false) Integer page,
                                                                 @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(inventoryService.getAll(pageRequestFactory.of(page, size, Sort.by("id"))));
    }

    @GetMapping("/low-stock")
    public ResponseEntity<List<InventoryDto>> lowStock() {
        return ResponseEntity.ok(inventoryService.getLowStock());
    }

    @GetMapping("/{id}")
    public ResponseEntity<InventoryDto> get(@PathVariable Integer id) {
        return ResponseEntity.ok(inventoryService.get(id));
    }

    @GetMapping("/medication/{medicationId}")
    public ResponseEntity<InventoryDto> getByMedication(@PathVariable Integer medicationId) {
        return ResponseEntity.ok(inventoryService.getByMedication(medicationId));
    }

    @PostMapping
    public ResponseEntity<InventoryDto> create(@Valid @RequestBody InventoryCreateDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inventoryService.create(dto));
    }

    @PutMapping("/{id}")
    public ResponseEntity<InventoryDto> update(@PathVariable Integer id, @Valid @RequestBody InventoryUpdateDto dto) {
        return ResponseEntity.ok(inventoryService.updateReorderLevel(id, dto.getReorderLevel()));
    }

    @PostMapping("/{id}/restock")
    public ResponseEntity<InventoryDto> restock(@PathVariable Integer id, @Valid @RequestBody StockMovementDto dto) {
        return ResponseEntity.ok(inventoryService.restock(id, dto.getQuantity(), dto.getDate()));
    }

    @PostMapping("/{id}/deduct")
    public ResponseEntity<InventoryDto> deduct(@PathVariable Integer id, @Valid @RequestBody StockMovementDto dto) {
        return ResponseEntity.ok(inventoryService.deduct(id, dto.getQuantity()));
    }
}
