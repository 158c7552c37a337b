package dev.kitchen.model;

/**
 * How an appetizer reaches the table. Unknown names map to {@link #PLATED}.
 */
public enum ServingStyle {
    PLATED("Plated"),
    FAMILY_STYLE("Family Style"),
    BUFFET("Buffet");

    private final String label;

    ServingStyle(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ServingStyle fromName(String name) {
        if (name == null) {
            return PLATED;
        }
        for (ServingStyle style : values()) {
            if (style.name().equalsIgnoreCase(name.trim())) {
                return style;
            }
        }
        return PLATED;
    }
}
