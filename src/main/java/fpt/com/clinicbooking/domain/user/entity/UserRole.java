package fpt.com.clinicbooking.domain.user.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.clinicbooking.common.util.PersistableEnum;

public enum UserRole implements PersistableEnum {
    ADMIN("admin"),
    RECEPTIONIST("receptionist"),
    DOCTOR("doctor"),
    NURSE("nurse"),
    PHARMACIST("pharmacist"),
    ACCOUNTANT("accountant");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static UserRole fromValue(String value) {
        return PersistableEnum.fromValue(UserRole.class, value);
    }
}
