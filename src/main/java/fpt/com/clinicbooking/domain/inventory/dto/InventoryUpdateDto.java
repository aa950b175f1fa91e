package fpt.com.clinicbooking.domain.inventory.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InventoryUpdateDto {

    @NotNull(message = "REORDER_LEVEL_REQUIRED")
    @Min(value = 0, message = "REORDER_LEVEL_NEGATIVE")
    private Integer reorderLevel;
}
