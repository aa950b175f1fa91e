package fpt.com.clinicbooking.domain.invoice.dto;

import fpt.com.clinicbooking.domain.invoice.entity.InvoiceStatus;
import fpt.com.clinicbooking.domain.user.dto.UserSummaryDto;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceDto {
    private Integer id;
    private Integer patientId;
    private String patientName;
    private Integer appointmentId;
    private LocalDate invoiceDate;
    private BigDecimal totalAmount;
    private InvoiceStatus status;
    private UserSummaryDto createdBy;
    private List<InvoiceItemDto> items;
    private LocalDateTime createdAt;
}
