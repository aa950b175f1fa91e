package fpt.com.clinicbooking.domain.appointment.entity;

import fpt.com.clinicbooking.common.util.PersistableEnumConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AppointmentStatusConverter extends PersistableEnumConverter<AppointmentStatus> {
    public AppointmentStatusConverter() {
        super(AppointmentStatus.class);
    }
}
