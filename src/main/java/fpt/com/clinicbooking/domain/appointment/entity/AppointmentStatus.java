package fpt.com.clinicbooking.domain.appointment.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.clinicbooking.common.util.PersistableEnum;

public enum AppointmentStatus implements PersistableEnum {
    SCHEDULED("scheduled"),
    CHECKED_IN("checked_in"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    NO_SHOW("no_show");

    private final String value;

    AppointmentStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AppointmentStatus fromValue(String value) {
        return PersistableEnum.fromValue(AppointmentStatus.class, value);
    }
}
