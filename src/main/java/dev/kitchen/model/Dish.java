package dev.kitchen.model;

import java.util.List;

/**
 * A dish on the order board. Exactly one of three shapes: appetizer, main course or dessert.
 * <p>
 * Dishes are values: two dishes with the same attributes are equal and interchangeable.
 */
public sealed interface Dish permits Appetizer, MainCourse, Dessert {

    int ELABORATE_MIN_INGREDIENTS = 5;
    int ELABORATE_MIN_PREP_TIME = 60;

    String name();

    List<String> ingredients();

    /** Preparation time in minutes. */
    int prepTime();

    double price();

    CuisineType cuisineType();

    /**
     * Return this dish adjusted for the given request. Flags a shape does not
     * understand are ignored; a request with no flags set returns an equal dish.
     */
    Dish applyDietaryAccommodations(DietaryRequest request);

    /**
     * A dish is elaborate when it has at least five ingredients and takes at least an hour.
     */
    default boolean isElaborate() {
        return ingredients().size() >= ELABORATE_MIN_INGREDIENTS
            && prepTime() >= ELABORATE_MIN_PREP_TIME;
    }
}
