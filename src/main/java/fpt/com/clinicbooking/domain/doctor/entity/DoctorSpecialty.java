package fpt.com.clinicbooking.domain.doctor.entity;

import fpt.com.clinicbooking.domain.masterdata.entity.Specialty;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Entity
@Table(name = "doctor_specialties")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DoctorSpecialty {

    @EmbeddedId
    @Builder.Default
    private DoctorSpecialtyId id = new DoctorSpecialtyId();

    @MapsId("doctorId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "doctor_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Doctor doctor;

    @MapsId("specialtyId")
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "specialty_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Specialty specialty;
}
