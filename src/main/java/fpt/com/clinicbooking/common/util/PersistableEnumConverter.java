package fpt.com.clinicbooking.common.util;

import jakarta.persistence.AttributeConverter;

/**
 * Base JPA converter writing {@link PersistableEnum#getValue()} to the column.
 */
public abstract class PersistableEnumConverter<E extends Enum<E> & PersistableEnum>
        implements AttributeConverter<E, String> {

    private final Class<E> type;

    protected PersistableEnumConverter(Class<E> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(E attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public E convertToEntityAttribute(String dbData) {
        return PersistableEnum.fromValue(type, dbData);
    }
}
