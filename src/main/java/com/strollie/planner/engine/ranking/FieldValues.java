package com.strollie.planner.engine.ranking;

import com.strollie.planner.error.ValidationException;

import java.util.Locale;

/**
 * Comparison and matching rules for loosely-typed record values.
 */
final class FieldValues {

    private FieldValues() {
    }

    /**
     * Numbers compare numerically, text case-insensitively, booleans false-first.
     * Any other pairing cannot be ordered and is a caller error.
     */
    static int compare(String field, Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return Double.compare(na.doubleValue(), nb.doubleValue());
        }
        if (a instanceof String sa && b instanceof String sb) {
            int c = sa.compareToIgnoreCase(sb);
            return c != 0 ? c : sa.compareTo(sb);
        }
        if (a instanceof Boolean ba && b instanceof Boolean bb) {
            return Boolean.compare(ba, bb);
        }
        throw new ValidationException(String.format(
                "Field '%s' mixes incomparable values: %s (%s) and %s (%s)",
                field, a, a.getClass().getSimpleName(), b, b.getClass().getSimpleName()));
    }

    /**
     * Text values match by case-insensitive substring; numbers and booleans by equality.
     */
    static boolean matches(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof String text) {
            return text.toLowerCase(Locale.ROOT).contains(expected.toString().toLowerCase(Locale.ROOT));
        }
        if (actual instanceof Number number) {
            Double wanted = toDouble(expected);
            return wanted != null && Double.compare(number.doubleValue(), wanted) == 0;
        }
        if (actual instanceof Boolean flag) {
            return expected instanceof Boolean b
                    ? flag.equals(b)
                    : flag.toString().equalsIgnoreCase(expected.toString().trim());
        }
        return actual.equals(expected);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
