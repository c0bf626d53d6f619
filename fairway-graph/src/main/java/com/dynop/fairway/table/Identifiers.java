package com.dynop.fairway.table;

/**
 * Normalisation of identifier values read from exports.
 *
 * <p>Numeric ids often arrive as floating point values (a column with gaps is read as
 * {@code 1001.0}). Graph ids are strings, so integral numbers are rendered without a
 * fraction and everything else is trimmed.
 */
public final class Identifiers {

    private Identifiers() {
        // Utility class
    }

    /**
     * @param value Raw column value
     * @return Identifier string, or null for null, blank or NaN values
     */
    public static String normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return null;
            }
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return value.toString();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
