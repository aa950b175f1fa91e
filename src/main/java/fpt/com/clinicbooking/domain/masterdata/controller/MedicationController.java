package fpt.com.clinicbooking.domain.masterdata.controller;

import fpt.com.clinicbooking.domain.masterdata.dto.MedicationDto;
import fpt.com.clinicbooking.domain.masterdata.dto.MedicationRequestDto;
import fpt.com.clinicbooking.domain.masterdata.service.MedicationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/medications")
@RequiredArgsConstructor
public class MedicationController {

    private final MedicationService medicationService;

    @GetMapping
    public List<MedicationDto> getAll(@RequestParam(required = false) String name) {
        return medicationService.getAll(name);
    }

    @GetMapping("/{id}")
    public MedicationDto get(@PathVariable Integer id) {
        return medicationService.get(id);
    }

    @PostMapping
    public ResponseEntity<MedicationDto> create(@Valid @RequestBody MedicationRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(medicationService.create(dto));
    }

    @PutMapping("/{id}")
    public MedicationDto update(@PathVariable Integer id, @Valid @RequestBody MedicationRequestDto dto) {
        return medicationService.update(id, dto);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Integer id) {
        medicationService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
