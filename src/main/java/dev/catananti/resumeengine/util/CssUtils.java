package dev.catananti.resumeengine.util;

import java.math.BigDecimal;

/**
 * Helpers for emitting CSS text.
 */
public final class CssUtils {

    private CssUtils() {}

    /**
     * Formats a number without a trailing {@code .0}: 28.0 becomes "28", 1.15 stays "1.15".
     */
    public static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String number(Number value) {
        return value == null ? "0" : number(value.doubleValue());
    }
}
