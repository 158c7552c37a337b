package dev.kitchen.model;

import java.util.List;

/**
 * Reacts to the nut-free, low-sugar and vegan flags. The vegan substitution runs on
 * the nut-free result when both are requested.
 */
public record Dessert(
    String name,
    List<String> ingredients,
    int prepTime,
    double price,
    CuisineType cuisineType,
    FlavorProfile flavorProfile,
    int sweetnessLevel,
    boolean containsNuts
) implements Dish {

    static final int LOW_SUGAR_SWEETNESS_STEP = 3;

    public Dessert {
        name = DishFields.requireText("dish name", name);
        ingredients = DishFields.copyOf("ingredients", ingredients);
        DishFields.requireNonNegative("prepTime", prepTime);
        DishFields.requireNonNegative("price", price);
        DishFields.requirePresent("cuisineType", cuisineType);
        DishFields.requirePresent("flavorProfile", flavorProfile);
        DishFields.requireNonNegative("sweetnessLevel", sweetnessLevel);
    }

    @Override
    public Dessert applyDietaryAccommodations(DietaryRequest request) {
        List<String> adjusted = ingredients;
        boolean nuts = containsNuts;
        int sweetness = sweetnessLevel;

        if (request.nutFree()) {
            nuts = false;
            adjusted = IngredientSubstitution.remove(adjusted, IngredientSubstitution.NUTS);
        }
        if (request.lowSugar()) {
            sweetness = Math.max(0, sweetness - LOW_SUGAR_SWEETNESS_STEP);
        }
        if (request.vegan()) {
            adjusted = IngredientSubstitution.substitute(adjusted,
                IngredientSubstitution.DAIRY_AND_EGGS, IngredientSubstitution.VEGAN_REPLACEMENTS);
        }

        return new Dessert(name, adjusted, prepTime, price, cuisineType,
            flavorProfile, sweetness, nuts);
    }
}
