package fpt.com.clinicbooking.domain.patient.entity;

import fpt.com.clinicbooking.common.util.PersistableEnumConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class GenderConverter extends PersistableEnumConverter<Gender> {
    public GenderConverter() {
        super(Gender.class);
    }
}
