package fpt.com.clinicbooking.domain.appointment.controller;

import fpt.com.clinicbooking.common.util.PageRequestFactory;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.appointment.dto.*;
import fpt.com.clinicbooking.domain.appointment.entity.AppointmentStatus;
import fpt.com.clinicbooking.domain.appointment.service.AppointmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/appointments")
@RequiredArgsConstructor
public class AppointmentController {

    private final AppointmentService appointmentService;
    private final PageRequestFactory pageRequestFactory;

    @GetMapping
    public ResponseEntity<PaginationResponse<AppointmentDto>> list(
            @RequestParam(required = false) Integer patientId,
            @RequestParam(required = false) Integer doctorId,
            @RequestParam(required = false) Integer roomId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(appointmentService.filter(patientId, doctorId, roomId,
                AppointmentStatus.fromValue(status), from, to,
                pageRequestFactory.of(page, size, Sort.by("scheduledStart"))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AppointmentDto> get(@PathVariable Integer id) {
        return ResponseEntity.ok(appointmentService.get(id));
    }

    @PostMapping
    public ResponseEntity<AppointmentDto> create(@Valid @RequestBody AppointmentCreateDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(appointmentService.create(dto));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AppointmentDto> update(@PathVariable Integer id, @Valid @RequestBody AppointmentUpdateDto dto) {
        return ResponseEntity.ok(appointmentService.reschedule(id, dto));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<AppointmentDto> changeStatus(@PathVariable Integer id,
                                                       @Valid @RequestBody AppointmentStatusUpdateDto dto) {
        return ResponseEntity.ok(appointmentService.changeStatus(id, dto.getStatus()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Integer id) {
        appointmentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ---- service lines ----

    @PostMapping("/{id}/services")
    public ResponseEntity<AppointmentDto> addService(@PathVariable Integer id,
                                                     @Valid @RequestBody AppointmentServiceLineDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(appointmentService.addService(id, dto));
    }

    @PutMapping("/{id}/services/{serviceId}")
    public ResponseEntity<AppointmentDto> updateService(@PathVariable Integer id,
                                                        @PathVariable Integer serviceId,
                                                        @Valid @RequestBody AppointmentServiceLineUpdateDto dto) {
        return ResponseEntity.ok(appointmentService.updateService(id, serviceId, dto));
    }

    @DeleteMapping("/{id}/services/{serviceId}")
    public ResponseEntity<AppointmentDto> removeService(@PathVariable Integer id, @PathVariable Integer serviceId) {
        return ResponseEntity.ok(appointmentService.removeService(id, serviceId));
    }
}
