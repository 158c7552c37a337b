package dev.kitchen.model;

import java.util.List;

/**
 * A starter. Reacts to the vegetarian, low-sodium and gluten-free flags.
 */
public record Appetizer(
    String name,
    List<String> ingredients,
    int prepTime,
    double price,
    CuisineType cuisineType,
    ServingStyle servingStyle,
    int spicinessLevel,
    boolean vegetarian
) implements Dish {

    static final int LOW_SODIUM_SPICINESS_STEP = 2;

    public Appetizer {
        name = DishFields.requireText("dish name", name);
        ingredients = DishFields.copyOf("ingredients", ingredients);
        DishFields.requireNonNegative("prepTime", prepTime);
        DishFields.requireNonNegative("price", price);
        DishFields.requirePresent("cuisineType", cuisineType);
        DishFields.requirePresent("servingStyle", servingStyle);
        DishFields.requireNonNegative("spicinessLevel", spicinessLevel);
    }

    @Override
    public Appetizer applyDietaryAccommodations(DietaryRequest request) {
        List<String> adjusted = ingredients;
        boolean isVegetarian = vegetarian;
        int spiciness = spicinessLevel;

        if (request.vegetarian()) {
            isVegetarian = true;
            adjusted = IngredientSubstitution.substitute(adjusted,
                IngredientSubstitution.NON_VEGETARIAN, IngredientSubstitution.VEGETARIAN_REPLACEMENTS);
        }
        if (request.lowSodium()) {
            spiciness = Math.max(0, spiciness - LOW_SODIUM_SPICINESS_STEP);
        }
        if (request.glutenFree()) {
            adjusted = IngredientSubstitution.remove(adjusted, IngredientSubstitution.GLUTEN);
        }

        return new Appetizer(name, adjusted, prepTime, price, cuisineType,
            servingStyle, spiciness, isVegetarian);
    }
}
