package dev.kitchen.model;

/**
 * Dominant flavor of a dessert. Unknown names map to {@link #SWEET}.
 */
public enum FlavorProfile {
    SWEET("Sweet"),
    BITTER("Bitter"),
    SOUR("Sour"),
    SALTY("Salty"),
    UMAMI("Umami");

    private final String label;

    FlavorProfile(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static FlavorProfile fromName(String name) {
        if (name == null) {
            return SWEET;
        }
        for (FlavorProfile profile : values()) {
            if (profile.name().equalsIgnoreCase(name.trim())) {
                return profile;
            }
        }
        return SWEET;
    }
}
