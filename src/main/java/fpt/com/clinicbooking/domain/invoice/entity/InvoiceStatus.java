package fpt.com.clinicbooking.domain.invoice.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import fpt.com.clinicbooking.common.util.PersistableEnum;

public enum InvoiceStatus implements PersistableEnum {
    PENDING("pending"),
    PAID("paid"),
    VOID("void");

    private final String value;

    InvoiceStatus(String value) {
        this.value = value;
    }

    @Override
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static InvoiceStatus fromValue(String value) {
        return PersistableEnum.fromValue(InvoiceStatus.class, value);
    }
}
