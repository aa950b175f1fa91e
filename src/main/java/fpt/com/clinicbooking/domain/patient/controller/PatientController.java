package fpt.com.clinicbooking.domain.patient.controller;

import fpt.com.clinicbooking.common.util.PageRequestFactory;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.patient.dto.*;
import fpt.com.clinicbooking.domain.patient.entity.Gender;
import fpt.com.clinicbooking.domain.patient.service.PatientDoctorService;
import fpt.com.clinicbooking.domain.patient.service.PatientService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/patients")
@RequiredArgsConstructor
public class PatientController {

    private final PatientService patientService;
    private final PatientDoctorService patientDoctorService;
    private final PageRequestFactory pageRequestFactory;

    @GetMapping
    public ResponseEntity<PaginationResponse<PatientDto>> list(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String phone,
            @RequestParam(required = false) String email,
            @RequestParam(required = false) String gender,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(patientService.filter(name, phone, email, Gender.fromValue(gender),
                pageRequestFactory.of(page, size, Sort.by("lastName", "firstName"))));
    }

    @GetMapping("/search")
    public ResponseEntity<List<PatientDto>> search(@RequestParam String name) {
        return ResponseEntity.ok(patientService.searchByName(name));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PatientDto> get(@PathVariable Integer id) {
        return ResponseEntity.ok(patientService.get(id));
    }

    @PostMapping
    public ResponseEntity<PatientDto> create(@Valid @RequestBody PatientRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(patientService.create(dto));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PatientDto> update(@PathVariable Integer id, @Valid @RequestBody PatientRequestDto dto) {
        return ResponseEntity.ok(patientService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Integer id) {
        patientService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ---- care team ----

    @GetMapping("/{id}/doctors")
    public ResponseEntity<List<PatientDoctorDto>> careTeam(@PathVariable Integer id) {
        return ResponseEntity.ok(patientDoctorService.getCareTeam(id));
    }

    @PostMapping("/{id}/doctors")
    public ResponseEntity<PatientDoctorDto> assignDoctor(@PathVariable Integer id,
                                                         @Valid @RequestBody PatientDoctorRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(patientDoctorService.assign(id, dto));
    }

    @PutMapping("/{id}/doctors/{doctorId}")
    public ResponseEntity<PatientDoctorDto> updateDoctor(@PathVariable Integer id,
                                                         @PathVariable Integer doctorId,
                                                         @Valid @RequestBody PatientDoctorUpdateDto dto) {
        return ResponseEntity.ok(patientDoctorService.setPrimary(id, doctorId, dto.getPrimary()));
    }

    @DeleteMapping("/{id}/doctors/{doctorId}")
    public ResponseEntity<Void> unassignDoctor(@PathVariable Integer id, @PathVariable Integer doctorId) {
        patientDoctorService.unassign(id, doctorId);
        return ResponseEntity.noContent().build();
    }
}
