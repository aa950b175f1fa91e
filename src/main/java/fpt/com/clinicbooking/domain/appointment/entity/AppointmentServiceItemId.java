package fpt.com.clinicbooking.domain.appointment.entity;

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
public class AppointmentServiceItemId implements Serializable {

    @Column(name = "appointment_id")
    private Integer appointmentId;

    @Column(name = "service_id")
    private Integer serviceId;
}
