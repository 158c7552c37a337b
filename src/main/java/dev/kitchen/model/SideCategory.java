package dev.kitchen.model;

/**
 * Category of a main course side dish. Unknown names map to {@link #GRAIN}, so an
 * unrecognised side is dropped by a gluten-free adjustment rather than kept.
 */
public enum SideCategory {
    GRAIN("Grain", true),
    PASTA("Pasta", true),
    LEGUME("Legume", false),
    BREAD("Bread", true),
    SALAD("Salad", false),
    SOUP("Soup", false),
    STARCHES("Starches", true),
    VEGETABLE("Vegetable", false);

    private final String label;
    private final boolean containsGluten;

    SideCategory(String label, boolean containsGluten) {
        this.label = label;
        this.containsGluten = containsGluten;
    }

    public String label() {
        return label;
    }

    public boolean containsGluten() {
        return containsGluten;
    }

    public static SideCategory fromName(String name) {
        if (name == null) {
            return GRAIN;
        }
        for (SideCategory category : values()) {
            if (category.name().equalsIgnoreCase(name.trim())) {
                return category;
            }
        }
        return GRAIN;
    }
}
