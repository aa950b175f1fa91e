package fpt.com.clinicbooking.domain.masterdata.entity;

import fpt.com.clinicbooking.common.constants.Constants;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Billable catalog entry: consultation type, lab test or procedure.
 */
@Entity
@Table(name = "services", indexes = {
        @Index(name = "idx_services_name", columnList = "name")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MedicalService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "service_id")
    private Integer id;

    @Column(name = "code", nullable = false, unique = true, length = 30)
    private String code;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price", nullable = false, precision = Constants.MONEY_PRECISION, scale = Constants.MONEY_SCALE)
    @ColumnDefault("0.00")
    @Builder.Default
    private BigDecimal price = new BigDecimal("0.00");

    @Column(name = "duration_minutes", nullable = false)
    @ColumnDefault("30")
    @Builder.Default
    private int durationMinutes = 30;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    @ColumnDefault("CURRENT_TIMESTAMP")
    private LocalDateTime createdAt;
}
