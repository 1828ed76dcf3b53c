package com.tresComas.financialData.common.util;

/**
 * Lenient coercion of loosely-typed provider values.
 * Missing, non-numeric and non-finite values fall back to the supplied default.
 */
public final class PayloadValues {

    private PayloadValues() {
    }

    public static double toDouble(Object value, double fallback) {
        if (value instanceof Number number) {
            double result = number.doubleValue();
            return Double.isFinite(result) ? result : fallback;
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                double result = Double.parseDouble(text.trim());
                return Double.isFinite(result) ? result : fallback;
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public static long toLong(Object value, long fallback) {
        double result = toDouble(value, Double.NaN);
        return Double.isNaN(result) ? fallback : (long) result;
    }

    public static String toText(Object value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String text = value.toString();
        return text.isBlank() ? fallback : text;
    }
}
