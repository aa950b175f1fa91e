package fpt.com.clinicbooking.domain.invoice.controller;

import fpt.com.clinicbooking.common.config.ClinicProperties;
import fpt.com.clinicbooking.common.exception.BusinessException;
import fpt.com.clinicbooking.common.exception.GlobalExceptionHandler;
import fpt.com.clinicbooking.common.util.PageRequestFactory;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceCreateDto;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceDto;
import fpt.com.clinicbooking.domain.invoice.dto.InvoiceItemRequestDto;
import fpt.com.clinicbooking.domain.invoice.entity.InvoiceStatus;
import fpt.com.clinicbooking.domain.invoice.service.InvoiceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InvoiceControllerTest {

    private InvoiceService invoiceService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        invoiceService = mock(InvoiceService.class);
        InvoiceController controller = new InvoiceController(invoiceService, new PageRequestFactory(new ClinicProperties()));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static InvoiceDto invoice(InvoiceStatus status) {
        return InvoiceDto.builder()
                .id(30)
                .patientId(1)
                .status(status)
                .totalAmount(new BigDecimal("150.00"))
                .items(List.of())
                .build();
    }

    @Test
    void create_returns201_withStatusAsLowercaseValue() throws Exception {
        when(invoiceService.create(any(InvoiceCreateDto.class))).thenReturn(invoice(InvoiceStatus.PENDING));

        mockMvc.perform(post("/api/v1/invoices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"patientId\":1,\"items\":[{\"description\":\"Consultation\",\"unitPrice\":150.00}]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(30))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.totalAmount").value(150.00));
    }

    @Test
    void create_returns400_whenPatientMissing() throws Exception {
        mockMvc.perform(post("/api/v1/invoices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.patientId").value("PATIENT_ID_REQUIRED"));
    }

    @Test
    void changeStatus_acceptsLowercaseValue() throws Exception {
        when(invoiceService.changeStatus(30, InvoiceStatus.PAID)).thenReturn(invoice(InvoiceStatus.PAID));

        mockMvc.perform(patch("/api/v1/invoices/30/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"paid\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("paid"));
    }

    @Test
    void changeStatus_returns400_forUnknownStatus() throws Exception {
        mockMvc.perform(patch("/api/v1/invoices/30/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"refunded\"}"))
                .andExpect(status().isBadRequest());

        verify(invoiceService, never()).changeStatus(any(), any());
    }

    @Test
    void addItem_returns422_whenInvoiceNotPending() throws Exception {
        when(invoiceService.addItem(eq(30), any(InvoiceItemRequestDto.class)))
                .thenThrow(new BusinessException("INVOICE_NOT_EDITABLE", Map.of("id", 30, "status", "paid")));

        mockMvc.perform(post("/api/v1/invoices/30/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serviceId\":5}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVOICE_NOT_EDITABLE"));
    }

    @Test
    void list_passesParsedStatusFilter() throws Exception {
        mockMvc.perform(get("/api/v1/invoices").param("patientId", "1").param("status", "VOID"))
                .andExpect(status().isOk());

        verify(invoiceService).search(eq(1), eq(InvoiceStatus.VOID), any());
    }
}
