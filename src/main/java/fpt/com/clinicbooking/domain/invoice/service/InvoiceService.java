package fpt.com.clinicbooking.domain.invoice.service;

import fpt.com.clinicbooking.common.exception.BadRequestException;
import fpt.com.clinicbooking.common.exception.BusinessException;
import fpt.com.clinicbooking.common.exception.NotFoundException;
import fpt.com.clinicbooking.common.util.MoneyUtil;
import fpt.com.clinicbooking.common.util.PaginationResponse;
import fpt.com.clinicbooking.domain.appointment.entity.Appointment;
import fpt.com.clinicbooking.domain.appointment.entity.AppointmentServiceItem;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.invoice.dto.*;
import fpt.com.clinicbooking.domain.invoice.entity.Invoice;
import fpt.com.clinicbooking.domain.invoice.entity.InvoiceItem;
import fpt.com.clinicbooking.domain.invoice.entity.InvoiceStatus;
import fpt.com.clinicbooking.domain.invoice.repository.InvoiceItemRepository;
import fpt.com.clinicbooking.domain.invoice.repository.InvoiceRepository;
import fpt.com.clinicbooking.domain.masterdata.entity.MedicalService;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicalServiceRepository;
import fpt.com.clinicbooking.domain.masterdata.repository.MedicationRepository;
import fpt.com.clinicbooking.domain.patient.entity.Patient;
import fpt.com.clinicbooking.domain.patient.repository.PatientRepository;
import fpt.com.clinicbooking.domain.user.dto.UserSummaryDto;
import fpt.com.clinicbooking.domain.user.entity.User;
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Invoices and their items. The stored total is recomputed here after every item change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final InvoiceItemRepository itemRepository;
    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;
    private final UserRepository userRepository;
    private final MedicalServiceRepository medicalServiceRepository;
    private final MedicationRepository medicationRepository;

    // ===================================================================================
    // CREATE
    // ===================================================================================
    public InvoiceDto create(InvoiceCreateDto dto) {
        Patient patient = patientRepository.findById(dto.getPatientId())
                .orElseThrow(() -> new NotFoundException("PATIENT_NOT_FOUND", Map.of("id", dto.getPatientId())));

        Appointment appointment = null;
        if (dto.getAppointmentId() != null) {
            appointment = findAppointment(dto.getAppointmentId());
            if (!appointment.getPatient().getId().equals(patient.getId())) {
                throw new BadRequestException("APPOINTMENT_PATIENT_MISMATCH",
                        Map.of("appointmentId", appointment.getId(), "patientId", patient.getId()));
            }
        }

        Invoice invoice = Invoice.builder()
                .patient(patient)
                .appointment(appointment)
                .createdBy(dto.getCreatedById() != null ? findUser(dto.getCreatedById()) : null)
                .invoiceDate(dto.getInvoiceDate() != null ? dto.getInvoiceDate() : LocalDate.now())
                .status(InvoiceStatus.PENDING)
                .build();
        if (dto.getItems() != null) {
            dto.getItems().forEach(i -> invoice.addItem(buildItem(i)));
        }
        invoice.recalculateTotal();

        Invoice saved = invoiceRepository.save(invoice);
        log.info("Invoice {} created for patient {} total {}", saved.getId(), patient.getId(), saved.getTotalAmount());
        return toDto(saved);
    }

    /**
     * Bills every service line of the appointment at its booked price.
     */
    public InvoiceDto createFromAppointment(Integer appointmentId, Integer createdById) {
        Appointment appointment = findAppointment(appointmentId);

        Invoice invoice = Invoice.builder()
                .patient(appointment.getPatient())
                .appointment(appointment)
                .createdBy(createdById != null ? findUser(createdById) : null)
                .invoiceDate(LocalDate.now())
                .status(InvoiceStatus.PENDING)
                .build();
        for (AppointmentServiceItem line : appointment.getServices()) {
            invoice.addItem(InvoiceItem.builder()
                    .description(line.getService().getName())
                    .service(line.getService())
                    .quantity(line.getQuantity())
                    .unitPrice(line.getUnitPrice())
                    .build());
        }
        invoice.recalculateTotal();

        Invoice saved = invoiceRepository.save(invoice);
        log.info("Invoice {} created from appointment {} ({} items)", saved.getId(), appointmentId, saved.getItems().size());
        return toDto(saved);
    }

    // ===================================================================================
    // READ
    // ===================================================================================
    @Transactional(readOnly = true)
    public InvoiceDto get(Integer id) {
        return toDto(findInvoice(id));
    }

    @Transactional(readOnly = true)
    public PaginationResponse<InvoiceDto> search(Integer patientId, InvoiceStatus status, Pageable pageable) {
        return PaginationResponse.fromPage(invoiceRepository.search(patientId, status, pageable), this::toDto);
    }

    // ===================================================================================
    // ITEMS (pending invoices only)
    // ===================================================================================
    public InvoiceDto addItem(Integer id, InvoiceItemRequestDto dto) {
        Invoice invoice = findInvoice(id);
        ensureEditable(invoice);

        InvoiceItem item = buildItem(dto);
        invoice.addItem(item);
        itemRepository.save(item);
        invoice.recalculateTotal();
        log.info("Item added to invoice {}, total now {}", id, invoice.getTotalAmount());
        return toDto(invoiceRepository.save(invoice));
    }

    public InvoiceDto removeItem(Integer id, Integer itemId) {
        Invoice invoice = findInvoice(id);
        ensureEditable(invoice);

        InvoiceItem item = invoice.getItems().stream()
                .filter(i -> i.getId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("INVOICE_ITEM_NOT_FOUND",
                        Map.of("invoiceId", id, "itemId", itemId)));
        invoice.getItems().remove(item);
        invoice.recalculateTotal();
        log.info("Item {} removed from invoice {}, total now {}", itemId, id, invoice.getTotalAmount());
        return toDto(invoiceRepository.save(invoice));
    }

    public InvoiceDto recalculate(Integer id) {
        Invoice invoice = findInvoice(id);
        BigDecimal before = invoice.getTotalAmount();
        invoice.recalculateTotal();
        if (before == null || before.compareTo(invoice.getTotalAmount()) != 0) {
            log.info("Invoice {} total corrected {} -> {}", id, before, invoice.getTotalAmount());
        }
        return toDto(invoiceRepository.save(invoice));
    }

    // ===================================================================================
    // STATUS / DELETE
    // ===================================================================================
    public InvoiceDto changeStatus(Integer id, InvoiceStatus status) {
        Invoice invoice = findInvoice(id);
        InvoiceStatus previous = invoice.getStatus();
        invoice.setStatus(status);
        log.info("Invoice {} status {} -> {}", id, previous.getValue(), status.getValue());
        return toDto(invoiceRepository.save(invoice));
    }

    public void delete(Integer id) {
        invoiceRepository.delete(findInvoice(id));
        log.info("Invoice {} deleted", id);
    }

    // ===================================================================================
    // HELPERS
    // ===================================================================================
    private void ensureEditable(Invoice invoice) {
        if (invoice.getStatus() != InvoiceStatus.PENDING) {
            throw new BusinessException("INVOICE_NOT_EDITABLE",
                    Map.of("id", invoice.getId(), "status", invoice.getStatus().getValue()));
        }
    }

    private InvoiceItem buildItem(InvoiceItemRequestDto dto) {
        MedicalService service = dto.getServiceId() == null ? null
                : medicalServiceRepository.findById(dto.getServiceId())
                    .orElseThrow(() -> new NotFoundException("SERVICE_NOT_FOUND", Map.of("id", dto.getServiceId())));
        Medication medication = dto.getMedicationId() == null ? null
                : medicationRepository.findById(dto.getMedicationId())
                    .orElseThrow(() -> new NotFoundException("MEDICATION_NOT_FOUND", Map.of("id", dto.getMedicationId())));

        String description = dto.getDescription() == null ? "" : dto.getDescription().trim();
        if (description.isEmpty()) {
            if (service != null) description = service.getName();
            else if (medication != null) description = medicationLabel(medication);
            else throw new BadRequestException("INVOICE_ITEM_SOURCE_REQUIRED");
        }

        BigDecimal price = dto.getUnitPrice();
        if (price == null) {
            if (service == null) throw new BadRequestException("UNIT_PRICE_REQUIRED");
            price = service.getPrice();
        }

        return InvoiceItem.builder()
                .description(description)
                .service(service)
                .medication(medication)
                .quantity(dto.getQuantity() != null ? dto.getQuantity() : 1)
                .unitPrice(MoneyUtil.normalize(price))
                .build();
    }

    private static String medicationLabel(Medication m) {
        return m.getStrength() == null ? m.getName() : m.getName() + " " + m.getStrength();
    }

    private Invoice findInvoice(Integer id) {
        return invoiceRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("INVOICE_NOT_FOUND", Map.of("id", id)));
    }

    private Appointment findAppointment(Integer id) {
        return appointmentRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("APPOINTMENT_NOT_FOUND", Map.of("id", id)));
    }

    private User findUser(Integer id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("USER_NOT_FOUND", Map.of("id", id)));
    }

    private InvoiceDto toDto(Invoice inv) {
        List<InvoiceItemDto> items = inv.getItems().stream()
                .map(i -> new InvoiceItemDto(
                        i.getId(),
                        i.getDescription(),
                        i.getService() != null ? i.getService().getId() : null,
                        i.getMedication() != null ? i.getMedication().getId() : null,
                        i.getQuantity(),
                        i.getUnitPrice(),
                        i.getLineTotal()))
                .collect(Collectors.toList());

        return InvoiceDto.builder()
                .id(inv.getId())
                .patientId(inv.getPatient().getId())
                .patientName(inv.getPatient().getFullName())
                .appointmentId(inv.getAppointment() != null ? inv.getAppointment().getId() : null)
                .invoiceDate(inv.getInvoiceDate())
                .totalAmount(inv.getTotalAmount())
                .status(inv.getStatus())
                .createdBy(UserSummaryDto.of(inv.getCreatedBy()))
                .items(items)
                .createdAt(inv.getCreatedAt())
                .build();
    }
}
