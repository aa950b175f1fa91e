package fpt.com.clinicbooking.domain.invoice.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@AllArgsConstructor
public class InvoiceItemDto {
    private Integer id;
    private String description;
    private Integer serviceId;
    private Integer medicationId;
    private int quantity;
    private BigDecimal unitPrice;
    private BigDecimal lineTotal;
}
