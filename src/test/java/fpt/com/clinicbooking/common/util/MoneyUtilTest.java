package fpt.com.clinicbooking.common.util;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import org.junit.jupiter.api.Test;

class MoneyUtilTest {

    @Test
    void lineTotal_multipliesQuantityByUnitPrice() {
        assertEquals(new BigDecimal("150.00"), MoneyUtil.lineTotal(3, new BigDecimal("50.00")));
    }

    @Test
    void lineTotal_isZero_whenPriceMissing() {
        assertEquals(new BigDecimal("0.00"), MoneyUtil.lineTotal(2, null));
    }

    @Test
    void normalize_roundsHalfUpToTwoDecimals() {
        assertEquals(new BigDecimal("10.13"), MoneyUtil.normalize(new BigDecimal("10.125")));
        assertEquals(new BigDecimal("7.00"), MoneyUtil.normalize(new BigDecimal("7")));
        assertNull(MoneyUtil.normalize(null));
    }
}
