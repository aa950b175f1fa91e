package fpt.com.clinicbooking.domain.masterdata.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "medications", uniqueConstraints = {
        @UniqueConstraint(name = "uk_medications_name_strength", columnNames = {"name", "strength"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Medication {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "medication_id")
    private Integer id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "manufacturer", length = 200)
    private String manufacturer;

    // tablet, ml, ...
    @Column(name = "unit", length = 50)
    private String unit;

    @Column(name = "strength", length = 100)
    private String strength;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    @ColumnDefault("CURRENT_TIMESTAMP")
    private LocalDateTime createdAt;
}
