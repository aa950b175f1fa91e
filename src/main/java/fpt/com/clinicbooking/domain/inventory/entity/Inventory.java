package fpt.com.clinicbooking.domain.inventory.entity;

import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDate;

/**
 * Stock level of one medication.
 */
@Entity
@Table(name = "inventory")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Inventory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "inventory_id")
    private Integer id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "medication_id", nullable = false, unique = true)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Medication medication;

    @Column(name = "quantity_on_hand", nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private int quantityOnHand = 0;

    @Column(name = "reorder_level", nullable = false)
    @ColumnDefault("0")
    @Builder.Default
    private int reorderLevel = 0;

    @Column(name = "last_restock")
    private LocalDate lastRestock;

    public boolean isLowStock() {
        return quantityOnHand <= reorderLevel;
    }
}
