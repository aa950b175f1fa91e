package fpt.com.clinicbooking.domain.invoice.entity;

import fpt.com.clinicbooking.common.constants.Constants;
import fpt.com.clinicbooking.common.util.MoneyUtil;
import fpt.com.clinicbooking.domain.appointment.entity.Appointment;
import fpt.com.clinicbooking.domain.patient.entity.Patient;
import fpt.com.clinicbooking.domain.user.entity.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Patient bill. {@code totalAmount} is stored, not derived by the database, so whoever
 * changes the items must call {@link #recalculateTotal()}.
 */
@Entity
@Table(name = "invoices")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "invoice_id")
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "patient_id", nullable = false)
    @OnDelete(action = OnDeleteAction.RESTRICT)
    private Patient patient;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "appointment_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Appointment appointment;

    @Column(name = "invoice_date", nullable = false)
    @ColumnDefault("CURRENT_DATE")
    @Builder.Default
    private LocalDate invoiceDate = LocalDate.now();

    @Column(name = "total_amount", nullable = false, precision = Constants.MONEY_PRECISION, scale = Constants.MONEY_SCALE)
    @ColumnDefault("0.00")
    @Builder.Default
    private BigDecimal totalAmount = MoneyUtil.ZERO;

    @Convert(converter = InvoiceStatusConverter.class)
    @Column(name = "status", nullable = false, length = 10)
    @ColumnDefault("'pending'")
    @Check(constraints = "status in ('pending','paid','void')")
    @Builder.Default
    private InvoiceStatus status = InvoiceStatus.PENDING;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private User createdBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    @ColumnDefault("CURRENT_TIMESTAMP")
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    @Builder.Default
    private List<InvoiceItem> items = new ArrayList<>();

    public void addItem(InvoiceItem item) {
        item.setInvoice(this);
        items.add(item);
    }

    public BigDecimal recalculateTotal() {
        BigDecimal total = items.stream()
                .map(InvoiceItem::getLineTotal)
                .reduce(MoneyUtil.ZERO, BigDecimal::add);
        totalAmount = MoneyUtil.normalize(total);
        return totalAmount;
    }
}
