package fpt.com.clinicbooking.domain.patient.entity;

import fpt.com.clinicbooking.domain.doctor.entity.Doctor;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDate;

/**
 * Care-team link between a patient and a doctor. Removed with either side.
 */
@Entity
@Table(name = "patient_doctors")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PatientDoctor {

    @EmbeddedId
    @Builder.Default
    private PatientDoctorId id = new PatientDoctorId();

    @MapsId("patientId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "patient_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Patient patient;

    @MapsId("doctorId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "doctor_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Doctor doctor;

    @Column(name = "is_primary", nullable = false)
    @ColumnDefault("false")
    @Builder.Default
    private boolean primary = false;

    @Column(name = "assigned_date", nullable = false)
    @ColumnDefault("CURRENT_DATE")
    @Builder.Default
    private LocalDate assignedDate = LocalDate.now();
}
