package fpt.com.clinicbooking.domain.patient.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.clinicbooking.common.util.PersistableEnum;

public enum Gender implements PersistableEnum {
    MALE("male"),
    FEMALE("female"),
    OTHER("other");

    private final String value;

    Gender(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Gender fromValue(String value) {
        return PersistableEnum.fromValue(Gender.class, value);
    }
}
