package dev.kitchen.model;

import java.util.List;

/**
 * Argument checks shared by the dish records.
 */
final class DishFields {

    private DishFields() {}

    static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing or empty " + field);
        }
        return value;
    }

    static int requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException("%s must be >= 0, got %d".formatted(field, value));
        }
        return value;
    }

    static double requireNonNegative(String field, double value) {
        // also rejects NaN
        if (!(value >= 0)) {
            throw new IllegalArgumentException("%s must be >= 0, got %s".formatted(field, value));
        }
        return value;
    }

    static <T> T requirePresent(String field, T value) {
        if (value == null) {
            throw new IllegalArgumentException("Missing " + field);
        }
        return value;
    }

    static <T> List<T> copyOf(String field, List<T> values) {
        requirePresent(field, values);
        for (T value : values) {
            if (value == null) {
                throw new IllegalArgumentException(field + " must not contain null entries");
            }
        }
        return List.copyOf(values);
    }
}
