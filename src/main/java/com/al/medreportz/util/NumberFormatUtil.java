package com.al.medreportz.util;

import java.math.BigDecimal;

/**
 * Renders numbers the way they are printed on reports: no forced decimals,
 * no trailing zeros, no exponent ("70", "11.2", "4.5").
 */
public final class NumberFormatUtil {

    private NumberFormatUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    public static String natural(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
