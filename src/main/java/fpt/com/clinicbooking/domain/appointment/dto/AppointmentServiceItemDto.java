package fpt.com.clinicbooking.domain.appointment.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

@Getter
@AllArgsConstructor
public class AppointmentServiceItemDto {
    private Integer serviceId;
    private String serviceCode;
    private String serviceName;
    private int quantity;
    private BigDecimal unitPrice;
    private BigDecimal lineTotal;
}
