package fpt.com.clinicbooking.domain.invoice.entity;

import fpt.com.clinicbooking.common.constants.Constants;
import fpt.com.clinicbooking.common.util.MoneyUtil;
import fpt.com.clinicbooking.domain.masterdata.entity.MedicalService;
import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.Formula;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;

/**
 * Invoice line. Must point at a service or a medication, or at least carry a description.
 */
@Entity
@Table(name = "invoice_items")
@Check(name = "chk_invoice_items_source",
        constraints = "service_id IS NOT NULL OR medication_id IS NOT NULL OR description <> ''")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InvoiceItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "invoice_item_id")
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "invoice_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Invoice invoice;

    @Column(name = "description", nullable = false, length = 255)
    private String description;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "service_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private MedicalService service;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "medication_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Medication medication;

    @Column(name = "quantity", nullable = false)
    @ColumnDefault("1")
    @Builder.Default
    private int quantity = 1;

    @Column(name = "unit_price", nullable = false, precision = Constants.MONEY_PRECISION, scale = Constants.MONEY_SCALE)
    private BigDecimal unitPrice;

    // computed on read, never written
    @Formula("quantity * unit_price")
    @Setter(AccessLevel.NONE)
    private BigDecimal lineTotal;

    /**
     * Value read from the database, or computed locally for a row not reloaded since it was written.
     */
    public BigDecimal getLineTotal() {
        return lineTotal != null ? MoneyUtil.normalize(lineTotal) : MoneyUtil.lineTotal(quantity, unitPrice);
    }
}
