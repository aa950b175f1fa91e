package fpt.com.clinicbooking.domain.invoice.controller;

import fpt.com.clinicbooking.common.util.PageRequestFactory;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceCreateDto;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceDto;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceItemRequestDto;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceStatusUpdateDto;
import fpt.com.clinicbooking.domain.invoice.entity.InvoiceStatus;
import fpt.com.clinicbooking.domain.invoice.service.InvoiceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceService invoiceService;
    private final PageRequestFactory pageRequestFactory;

    @GetMapping
    public ResponseEntity<PaginationResponse<InvoiceDto>> list(
            @RequestParam(required = false) Integer patientId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return ResponseEntity.ok(invoiceService.search(patientId, InvoiceStatus.fromValue(status),
                pageRequestFactory.of(page, size, Sort.by(Sort.Order.desc("invoiceDate"), Sort.Order.desc("id")))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceDto> get(@PathVariable Integer id) {
        return ResponseEntity.ok(invoiceService.get(id));
    }

    @PostMapping
    public ResponseEntity<InvoiceDto> create(@Valid @RequestBody InvoiceCreateDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(invoiceService.create(dto));
    }

    @PostMapping("/from-appointment/{appointmentId}")
    public ResponseEntity<InvoiceDto> createFromAppointment(@PathVariable Integer appointmentId,
                                                            @RequestParam(required = false) Integer createdById) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(invoiceService.createFromAppointment(appointmentId, createdById));
    }

    @PostMapping("/{id}/items")
    public ResponseEntity<InvoiceDto> addItem(@PathVariable Integer id, @Valid @RequestBody InvoiceItemRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(invoiceService.addItem(id, dto));
    }

    @DeleteMapping("/{id}/items/{itemId}")
    public ResponseEntity<InvoiceDto> removeItem(@PathVariable Integer id, @PathVariable Integer itemId) {
        return ResponseEntity.ok(invoiceService.removeItem(id, itemId));
    }

    @PostMapping("/{id}/recalculate")
    public ResponseEntity<InvoiceDto> recalculate(@PathVariable Integer id) {
        return ResponseEntity.ok(invoiceService.recalculate(id));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<InvoiceDto> changeStatus(@PathVariable Integer id,
                                                   @Valid @RequestBody InvoiceStatusUpdateDto dto) {
        return ResponseEntity.ok(invoiceService.changeStatus(id, dto.getStatus()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Integer id) {
        invoiceService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
