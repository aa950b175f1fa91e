package fpt.com.clinicbooking.common.util;

/**
 * Enum stored (and serialized) as a lowercase literal such as {@code checked_in}.
 */
public interface PersistableEnum {

    String getValue();

    static <E extends Enum<E> & PersistableEnum> E fromValue(Class<E> type, String value) {
        if (value == null || value.isBlank()) return null;
        String input = value.trim();
        for (E e : type.getEnumConstants()) {
            if (e.getValue().equalsIgnoreCase(input) || e.name().equalsIgnoreCase(input)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " value: " + value);
    }
}
