package fpt.com.clinicbooking.domain.prescription.controller;

import fpt.com.clinicbooking.domain.prescription.dto.PrescriptionCreateDto;
import fpt.com.clinicbooking.domain.prescription.dto.PrescriptionDto;
import fpt.com.clinicbooking.domain.prescription.dto.PrescriptionItemRequestDto;
import fpt.com.clinicbooking.domain.prescription.dto.PrescriptionUpdateDto;
import fpt.com.clinicbooking.domain.prescription.service.PrescriptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PrescriptionController {

    private final PrescriptionService prescriptionService;

    @PostMapping("/prescriptions")
    public ResponseEntity<PrescriptionDto> create(@Valid @RequestBody PrescriptionCreateDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(prescriptionService.create(dto));
    }

    @GetMapping("/prescriptions/{id}")
    public ResponseEntity<PrescriptionDto> get(@PathVariable Integer id) {
        return ResponseEntity.ok(prescriptionService.get(id));
    }

    @GetMapping("/appointments/{appointmentId}/prescription")
    public ResponseEntity<PrescriptionDto> getByAppointment(@PathVariable Integer appointmentId) {
        return ResponseEntity.ok(prescriptionService.getByAppointment(appointmentId));
    }

    @PutMapping("/prescriptions/{id}")
    public ResponseEntity<PrescriptionDto> update(@PathVariable Integer id, @RequestBody PrescriptionUpdateDto dto) {
        return ResponseEntity.ok(prescriptionService.updateNotes(id, dto.getNotes()));
    }

    @PostMapping("/prescriptions/{id}/items")
    public ResponseEntity<PrescriptionDto> addItem(@PathVariable Integer id,
                                                   @Valid @RequestBody PrescriptionItemRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(prescriptionService.addItem(id, dto));
    }

    @DeleteMapping("/prescriptions/{id}/items/{itemId}")
    public ResponseEntity<PrescriptionDto> removeItem(@PathVariable Integer id, @PathVariable Integer itemId) {
        return ResponseEntity.ok(prescriptionService.removeItem(id, itemId));
    }

    @DeleteMapping("/prescriptions/{id}")
    public ResponseEntity<Void> delete(@PathVariable Integer id) {
        prescriptionService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
