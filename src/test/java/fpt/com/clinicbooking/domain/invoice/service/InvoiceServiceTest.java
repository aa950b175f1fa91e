package fpt.com.clinicbooking.domain.invoice.service;

import fpt.com.clinicbooking.common.exception.BadRequestException;
import fpt.com.clinicbooking.common.exception.BusinessException;
import fpt.com.clinicbooking.domain.appointment.entity.Appointment;
import fpt.com.clinicbooking.domain.appointment.entity.AppointmentServiceItem;
import fpt.com.clinicbooking.domain.appointment.repository.AppointmentRepository;
import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceCreateDto;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceDto;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceItemRequestDto;
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
import fpt.com.clinicbooking.domain.user.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class InvoiceServiceTest {

    private InvoiceRepository invoiceRepository;
    private InvoiceItemRepository itemRepository;
    private PatientRepository patientRepository;
    private AppointmentRepository appointmentRepository;
    private MedicalServiceRepository medicalServiceRepository;
    private MedicationRepository medicationRepository;
    private InvoiceService service;

    private Patient patient;
    private MedicalService xray;
    private Medication amoxicillin;

    @BeforeEach
    void setUp() {
        invoiceRepository = mock(InvoiceRepository.class);
        itemRepository = mock(InvoiceItemRepository.class);
        patientRepository = mock(PatientRepository.class);
        appointmentRepository = mock(AppointmentRepository.class);
        medicalServiceRepository = mock(MedicalServiceRepository.class);
        medicationRepository = mock(MedicationRepository.class);
        service = new InvoiceService(invoiceRepository, itemRepository, patientRepository, appointmentRepository,
                mock(UserRepository.class), medicalServiceRepository, medicationRepository);

        patient = Patient.builder().id(1).firstName("Lan").lastName("Tran").build();
        xray = MedicalService.builder().id(8).code("XRAY").name("Chest X-ray").price(new BigDecimal("80.00")).build();
        amoxicillin = Medication.builder().id(4).name("Amoxicillin").strength("500 mg").build();

        when(patientRepository.findById(1)).thenReturn(Optional.of(patient));
        when(medicalServiceRepository.findById(8)).thenReturn(Optional.of(xray));
        when(medicationRepository.findById(4)).thenReturn(Optional.of(amoxicillin));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> {
            Invoice i = inv.getArgument(0);
            if (i.getId() == null) i.setId(30);
            return i;
        });
    }

    private InvoiceCreateDto invoiceFor(InvoiceItemRequestDto... items) {
        return InvoiceCreateDto.builder().patientId(1).items(List.of(items)).build();
    }

    @Test
    void create_fillsDescriptionAndPriceFromService_andTotals() {
        InvoiceDto dto = service.create(invoiceFor(
                InvoiceItemRequestDto.builder().serviceId(8).build(),
                InvoiceItemRequestDto.builder().medicationId(4).quantity(3).unitPrice(new BigDecimal("50.00")).build()));

        assertEquals(InvoiceStatus.PENDING, dto.getStatus());
        assertEquals(LocalDate.now(), dto.getInvoiceDate());
        assertEquals("Chest X-ray", dto.getItems().get(0).getDescription());
        assertEquals(new BigDecimal("80.00"), dto.getItems().get(0).getUnitPrice());
        assertEquals("Amoxicillin 500 mg", dto.getItems().get(1).getDescription());
        assertEquals(new BigDecimal("150.00"), dto.getItems().get(1).getLineTotal());
        assertEquals(new BigDecimal("230.00"), dto.getTotalAmount());
    }

    @Test
    void create_acceptsFreeTextItem() {
        InvoiceDto dto = service.create(invoiceFor(
                InvoiceItemRequestDto.builder().description("Late fee").unitPrice(new BigDecimal("5")).build()));

        assertNull(dto.getItems().get(0).getServiceId());
        assertNull(dto.getItems().get(0).getMedicationId());
        assertEquals(new BigDecimal("5.00"), dto.getTotalAmount());
    }

    @Test
    void create_rejectsItemWithoutServiceMedicationOrDescription() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> service.create(invoiceFor(
                InvoiceItemRequestDto.builder().description("  ").unitPrice(BigDecimal.ONE).build())));

        assertEquals("INVOICE_ITEM_SOURCE_REQUIRED", ex.getCode());
    }

    @Test
    void create_rejectsMedicationItemWithoutPrice() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> service.create(invoiceFor(
                InvoiceItemRequestDto.builder().medicationId(4).build())));

        assertEquals("UNIT_PRICE_REQUIRED", ex.getCode());
    }

    @Test
    void create_rejectsAppointmentOfAnotherPatient() {
        Patient other = Patient.builder().id(2).firstName("Bao").lastName("Ngo").build();
        Appointment appointment = Appointment.builder().id(50).patient(other).build();
        when(appointmentRepository.findById(50)).thenReturn(Optional.of(appointment));

        InvoiceCreateDto dto = invoiceFor();
        dto.setAppointmentId(50);

        BadRequestException ex = assertThrows(BadRequestException.class, () -> service.create(dto));
        assertEquals("APPOINTMENT_PATIENT_MISMATCH", ex.getCode());
    }

    @Test
    void createFromAppointment_billsEachServiceLineAtBookedPrice() {
        Appointment appointment = Appointment.builder().id(50).patient(patient)
                .doctor(Doctor.builder().id(2).firstName("Minh").lastName("Le").build())
                .scheduledStart(LocalDateTime.now()).scheduledEnd(LocalDateTime.now().plusHours(1))
                .build();
        appointment.addService(AppointmentServiceItem.builder()
                .service(xray).quantity(2).unitPrice(new BigDecimal("75.00")).build());
        when(appointmentRepository.findById(50)).thenReturn(Optional.of(appointment));

        InvoiceDto dto = service.createFromAppointment(50, null);

        assertEquals(50, dto.getAppointmentId());
        assertEquals(1, dto.getItems().size());
        assertEquals(8, dto.getItems().get(0).getServiceId());
        assertEquals(new BigDecimal("150.00"), dto.getTotalAmount());
    }

    @Test
    void addItem_refused_whenInvoiceNotPending() {
        Invoice paid = Invoice.builder().id(30).patient(patient).status(InvoiceStatus.PAID).build();
        when(invoiceRepository.findById(30)).thenReturn(Optional.of(paid));

        BusinessException ex = assertThrows(BusinessException.class,
                () -> service.addItem(30, InvoiceItemRequestDto.builder().serviceId(8).build()));

        assertEquals("INVOICE_NOT_EDITABLE", ex.getCode());
        verify(itemRepository, never()).save(any());
    }

    @Test
    void removeItem_recomputesTotal() {
        Invoice invoice = Invoice.builder().id(30).patient(patient).build();
        invoice.addItem(InvoiceItem.builder().id(1).description("A").quantity(1).unitPrice(new BigDecimal("10.00")).build());
        invoice.addItem(InvoiceItem.builder().id(2).description("B").quantity(2).unitPrice(new BigDecimal("20.00")).build());
        invoice.recalculateTotal();
        when(invoiceRepository.findById(30)).thenReturn(Optional.of(invoice));

        InvoiceDto dto = service.removeItem(30, 2);

        assertEquals(1, dto.getItems().size());
        assertEquals(new BigDecimal("10.00"), dto.getTotalAmount());
    }

    @Test
    void recalculate_correctsDriftedTotal() {
        Invoice invoice = Invoice.builder().id(30).patient(patient).totalAmount(new BigDecimal("999.00")).build();
        invoice.addItem(InvoiceItem.builder().id(1).description("A").quantity(3).unitPrice(new BigDecimal("50.00")).build());
        when(invoiceRepository.findById(30)).thenReturn(Optional.of(invoice));

        assertEquals(new BigDecimal("150.00"), service.recalculate(30).getTotalAmount());
    }
}
