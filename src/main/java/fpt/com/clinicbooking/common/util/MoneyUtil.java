package fpt.com.clinicbooking.common.util;

import fpt.com.clinicbooking.common.constants.Constants;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for DECIMAL(12,2) amounts.
 */
public final class MoneyUtil {

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(Constants.MONEY_SCALE);

    private MoneyUtil() {}

    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) return null;
        return amount.setScale(Constants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal lineTotal(int quantity, BigDecimal unitPrice) {
        if (unitPrice == null) return ZERO;
        return normalize(unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }
}
