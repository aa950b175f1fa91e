package fpt.com.clinicbooking.domain.appointment.entity;

import fpt.com.clinicbooking.common.constants.Constants;
import fpt.com.clinicbooking.common.util.MoneyUtil;
import fpt.com.clinicbooking.domain.masterdata.entity.MedicalService;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;

/**
 * A service performed during an appointment, row of {@code appointment_services}.
 * {@code unitPrice} is the catalog price captured when the line was added.
 */
@Entity
@Table(name = "appointment_services")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppointmentServiceItem {

    @EmbeddedId
    @Builder.Default
    private AppointmentServiceItemId id = new AppointmentServiceItemId();

    @MapsId("appointmentId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "appointment_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Appointment appointment;

    @MapsId("serviceId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "service_id", nullable = false)
    @OnDelete(action = OnDeleteAction.RESTRICT)
    private MedicalService service;

    @Column(name = "quantity", nullable = false)
    @ColumnDefault("1")
    @Builder.Default
    private int quantity = 1;

    @Column(name = "unit_price", nullable = false, precision = Constants.MONEY_PRECISION, scale = Constants.MONEY_SCALE)
    private BigDecimal unitPrice;

    public BigDecimal getLineTotal() {
        return MoneyUtil.lineTotal(quantity, unitPrice);
    }
}
