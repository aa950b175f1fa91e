package fpt.com.clinicbooking.domain.doctor.controller;

import fpt.com.clinicbooking.common.util.PageRequestFactory;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.doctor.dto.DoctorDto;
import fpt.com.clinicbooking.domain.doctor.dto.DoctorRequestDto;
import fpt.com.clinicbooking.domain.doctor.dto.DoctorUserLinkDto;
import fpt.com.clinicbooking.domain.doctor.service.DoctorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/doctors")
@RequiredArgsConstructor
public class DoctorController {

    private final DoctorService doctorService;
    private final PageRequestFactory pageRequestFactory;

    @GetMapping
    public ResponseEntity<PaginationResponse<DoctorDto>> list(
            @RequestParam(required = false) Integer specialtyId,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(doctorService.search(specialtyId, name,
                pageRequestFactory.of(page, size, Sort.by("lastName", "firstName"))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DoctorDto> get(@PathVariable Integer id) {
        return ResponseEntity.ok(doctorService.get(id));
    }

    @PostMapping
    public ResponseEntity<DoctorDto> create(@Valid @RequestBody DoctorRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(doctorService.create(dto));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DoctorDto> update(@PathVariable Integer id, @Valid @RequestBody DoctorRequestDto dto) {
        return ResponseEntity.ok(doctorService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Integer id) {
        doctorService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/user")
    public ResponseEntity<DoctorDto> linkUser(@PathVariable Integer id, @Valid @RequestBody DoctorUserLinkDto dto) {
        return ResponseEntity.ok(doctorService.linkUser(id, dto.getUserId()));
    }

    @DeleteMapping("/{id}/user")
    public ResponseEntity<DoctorDto> unlinkUser(@PathVariable Integer id) {
        return ResponseEntity.ok(doctorService.unlinkUser(id));
    }

    @PostMapping("/{id}/specialties/{specialtyId}")
    public ResponseEntity<DoctorDto> addSpecialty(@PathVariable Integer id, @PathVariable Integer specialtyId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(doctorService.addSpecialty(id, specialtyId));
    }

    @DeleteMapping("/{id}/specialties/{specialtyId}")
    public ResponseEntity<DoctorDto> removeSpecialty(@PathVariable Integer id, @PathVariable Integer specialtyId) {
        return ResponseEntity.ok(doctorService.removeSpecialty(id, specialtyId));
    }
}
