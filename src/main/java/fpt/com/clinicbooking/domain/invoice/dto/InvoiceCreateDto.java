package fpt.com.clinicbooking.domain.invoice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceCreateDto {

    @NotNull(message = "PATIENT_ID_REQUIRED")
    private Integer patientId;

    private Integer appointmentId;

    private Integer createdById;

    // today when omitted
    private LocalDate invoiceDate;

    @Valid
    @Builder.Default
    private List<InvoiceItemRequestDto> items = new ArrayList<>();
}
