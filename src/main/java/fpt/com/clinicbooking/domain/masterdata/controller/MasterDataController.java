package fpt.com.clinicbooking.domain.masterdata.controller;

import fpt.com.clinicbooking.domain.masterdata.dto.*;
import fpt.com.clinicbooking.domain.masterdata.service.MedicalServiceService;
import fpt.com.clinicbooking.domain.masterdata.service.RoomService;
import fpt.com.clinicbooking.domain.masterdata.service.SpecialtyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Specialties, rooms and the service catalog.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MasterDataController {

    private final SpecialtyService specialtyService;
    private final RoomService roomService;
    private final MedicalServiceService medicalServiceService;

    // ---- specialties ----

    @GetMapping("/specialties")
    public List<SpecialtyDto> getSpecialties() {
        return specialtyService.getAll();
    }

    @GetMapping("/specialties/{id}")
    public SpecialtyDto getSpecialty(@PathVariable Integer id) {
        return specialtyService.get(id);
    }

    @PostMapping("/specialties")
    public ResponseEntity<SpecialtyDto> createSpecialty(@Valid @RequestBody SpecialtyRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(specialtyService.create(dto));
    }

    @PutMapping("/specialties/{id}")
    public SpecialtyDto updateSpecialty(@PathVariable Integer id, @Valid @RequestBody SpecialtyRequestDto dto) {
        return specialtyService.update(id, dto);
    }

    @DeleteMapping("/specialties/{id}")
    public ResponseEntity<Void> deleteSpecialty(@PathVariable Integer id) {
        specialtyService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ---- rooms ----

    @GetMapping("/rooms")
    public List<RoomDto> getRooms() {
        return roomService.getAll();
    }

    @GetMapping("/rooms/{id}")
    public RoomDto getRoom(@PathVariable Integer id) {
        return roomService.get(id);
    }

    @PostMapping("/rooms")
    public ResponseEntity<RoomDto> createRoom(@Valid @RequestBody RoomRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(roomService.create(dto));
    }

    @PutMapping("/rooms/{id}")
    public RoomDto updateRoom(@PathVariable Integer id, @Valid @RequestBody RoomRequestDto dto) {
        return roomService.update(id, dto);
    }

    @DeleteMapping("/rooms/{id}")
    public ResponseEntity<Void> deleteRoom(@PathVariable Integer id) {
        roomService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ---- services ----

    @GetMapping("/services")
    public List<MedicalServiceDto> getServices(@RequestParam(required = false) String name) {
        return medicalServiceService.getAll(name);
    }

    @GetMapping("/services/{id}")
    public MedicalServiceDto getService(@PathVariable Integer id) {
        return medicalServiceService.get(id);
    }

    @GetMapping("/services/code/{code}")
    public MedicalServiceDto getServiceByCode(@PathVariable String code) {
        return medicalServiceService.getByCode(code);
    }

    @PostMapping("/services")
    public ResponseEntity<MedicalServiceDto> createService(@Valid @RequestBody MedicalServiceRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(medicalServiceService.create(dto));
    }

    @PutMapping("/services/{id}")
    public MedicalServiceDto updateService(@PathVariable Integer id, @Valid @RequestBody MedicalServiceRequestDto dto) {
        return medicalServiceService.update(id, dto);
    }

    @DeleteMapping("/services/{id}")
    public ResponseEntity<Void> deleteService(@PathVariable Integer id) {
        medicalServiceService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
