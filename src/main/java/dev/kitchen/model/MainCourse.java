package dev.kitchen.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Reacts to the vegetarian, vegan and gluten-free flags. Gluten-free drops sides
 * rather than ingredients.
 */
public record MainCourse(
    String name,
    List<String> ingredients,
    int prepTime,
    double price,
    CuisineType cuisineType,
    CookingMethod cookingMethod,
    String proteinType,
    List<SideDish> sideDishes,
    boolean glutenFree
) implements Dish {

    public static final String PLANT_PROTEIN = "Tofu";

    public MainCourse {
        name = DishFields.requireText("dish name", name);
        ingredients = DishFields.copyOf("ingredients", ingredients);
        DishFields.requireNonNegative("prepTime", prepTime);
        DishFields.requireNonNegative("price", price);
        DishFields.requirePresent("cuisineType", cuisineType);
        DishFields.requirePresent("cookingMethod", cookingMethod);
        proteinType = DishFields.requireText("protein type", proteinType);
        sideDishes = DishFields.copyOf("sideDishes", sideDishes);
    }

    @Override
    public MainCourse applyDietaryAccommodations(DietaryRequest request) {
        List<String> adjusted = ingredients;
        String protein = proteinType;
        List<SideDish> sides = sideDishes;
        boolean isGlutenFree = glutenFree;

        if (request.vegetarian()) {
            protein = PLANT_PROTEIN;
            adjusted = IngredientSubstitution.substitute(adjusted,
                IngredientSubstitution.NON_VEGETARIAN, IngredientSubstitution.VEGETARIAN_REPLACEMENTS);
        }
        if (request.vegan()) {
            // Beans/Mushrooms are never dairy, so this yields the same removals as on the original list
            protein = PLANT_PROTEIN;
            adjusted = IngredientSubstitution.remove(adjusted, IngredientSubstitution.DAIRY_AND_EGGS);
        }
        if (request.glutenFree()) {
            isGlutenFree = true;
            var kept = new ArrayList<SideDish>(sides.size());
            for (SideDish side : sides) {
                if (!side.category().containsGluten()) {
                    kept.add(side);
                }
            }
            sides = kept;
        }

        return new MainCourse(name, adjusted, prepTime, price, cuisineType,
            cookingMethod, protein, sides, isGlutenFree);
    }
}
