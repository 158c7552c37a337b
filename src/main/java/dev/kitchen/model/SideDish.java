package dev.kitchen.model;

/**
 * A side served with a main course.
 */
public record SideDish(String name, SideCategory category) {

    public SideDish {
        name = DishFields.requireText("side dish name", name);
        if (category == null) {
            throw new IllegalArgumentException("Side dish '%s' has no category".formatted(name));
        }
    }
}
