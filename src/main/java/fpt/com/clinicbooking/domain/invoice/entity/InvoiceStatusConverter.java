package fpt.com.clinicbooking.domain.invoice.entity;

import fpt.com.clinicbooking.common.util.PersistableEnumConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class InvoiceStatusConverter extends PersistableEnumConverter<InvoiceStatus> {
    public InvoiceStatusConverter() {
        super(InvoiceStatus.class);
    }
}
