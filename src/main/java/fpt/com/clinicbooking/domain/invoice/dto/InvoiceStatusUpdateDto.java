package fpt.com.clinicbooking.domain.invoice.dto;

import fpt.com.clinicbooking.domain.invoice.entity.InvoiceStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceStatusUpdateDto {

    @NotNull(message = "STATUS_REQUIRED")
    private InvoiceStatus status;
}
