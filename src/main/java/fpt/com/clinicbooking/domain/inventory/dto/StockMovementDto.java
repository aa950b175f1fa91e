package fpt.com.clinicbooking.domain.inventory.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.*;

import java.time.LocalDate;

/**
 * Quantity added by a restock or removed by a deduction. {@code date} only matters for restocks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockMovementDto {

    @NotNull(message = "QUANTITY_REQUIRED")
    @Positive(message = "QUANTITY_POSITIVE")
    private Integer quantity;

    private LocalDate date;
}
