package dev.kitchen.model;

/**
 * Cuisine a dish belongs to. Unknown names map to {@link #OTHER}.
 */
public enum CuisineType {
    ITALIAN,
    MEXICAN,
    CHINESE,
    INDIAN,
    AMERICAN,
    FRENCH,
    OTHER;

    public static CuisineType fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        for (CuisineType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        return OTHER;
    }
}
