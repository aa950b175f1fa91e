package fpt.com.clinicbooking.domain.prescription.entity;

import fpt.com.clinicbooking.domain.masterdata.entity.Medication;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Entity
@Table(name = "prescription_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrescriptionItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "prescription_item_id")
    private Integer id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prescription_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Prescription prescription;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "medication_id", nullable = false)
    @OnDelete(action = OnDeleteAction.RESTRICT)
    private Medication medication;

    // e.g. "500 mg"
    @Column(name = "dosage", nullable = false, length = 100)
    private String dosage;

    // e.g. "twice daily"
    @Column(name = "frequency", nullable = false, length = 100)
    private String frequency;

    @Column(name = "duration_days")
    private Integer durationDays;

    @Column(name = "instructions", columnDefinition = "TEXT")
    private String instructions;
}
