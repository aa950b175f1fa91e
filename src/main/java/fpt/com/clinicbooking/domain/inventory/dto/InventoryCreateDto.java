package fpt.com.clinicbooking.domain.inventory.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryCreateDto {

    @NotNull(message = "MEDICATION_ID_REQUIRED")
    private Integer medicationId;

    @Min(value = 0, message = "QUANTITY_NEGATIVE")
    private Integer quantityOnHand;

    @Min(value = 0, message = "REORDER_LEVEL_NEGATIVE")
    private Integer reorderLevel;

    private LocalDate lastRestock;
}
