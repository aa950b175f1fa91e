package fpt.com.clinicbooking.domain.inventory.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;

@Getter
@AllArgsConstructor
public class InventoryDto {
    private Integer id;
    private Integer medicationId;
    private String medicationName;
    private String strength;
    private int quantityOnHand;
    private int reorderLevel;
    private LocalDate lastRestock;
    private boolean lowStock;
}
