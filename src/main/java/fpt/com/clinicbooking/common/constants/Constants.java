package fpt.com.clinicbooking.common.constants;


/**
 * Shared constants used across the service.
 */
public final class Constants {

    private Constants() {}

    // Money columns are DECIMAL(12,2)
    public static final int MONEY_PRECISION = 12;
    public static final int MONEY_SCALE = 2;
}
