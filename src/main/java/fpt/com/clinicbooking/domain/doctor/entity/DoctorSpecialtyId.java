package fpt.com.clinicbooking.domain.doctor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.io.Serializable;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class DoctorSpecialtyId implements Serializable {

    @Column(name = "doctor_id")
    private Integer doctorId;

    @Column(name = "specialty_id")
    private Integer specialtyId;
}
