package dev.kitchen.model;

/**
 * Unknown names map to {@link #GRILLED}.
 */
public enum CookingMethod {
    GRILLED("Grilled"),
    BAKED("Baked"),
    BOILED("Boiled"),
    FRIED("Fried"),
    STEAMED("Steamed"),
    RAW("Raw");

    private final String label;

    CookingMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CookingMethod fromName(String name) {
        if (name == null) {
            return GRILLED;
        }
        for (CookingMethod method : values()) {
            if (method.name().equalsIgnoreCase(name.trim())) {
                return method;
            }
        }
        return GRILLED;
    }
}
