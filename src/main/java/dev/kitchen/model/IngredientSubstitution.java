package dev.kitchen.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Bounded ordered substitution over an ingredient list.
 * <p>
 * Banned ingredients are replaced, in the order they are met, by the next unused
 * replacement. Once every replacement has been used, further banned ingredients are
 * dropped. Everything else passes through in its original order.
 */
public final class IngredientSubstitution {

    public static final Set<String> NON_VEGETARIAN =
        Set.of("Meat", "Chicken", "Fish", "Beef", "Pork", "Lamb", "Shrimp", "Bacon");

    public static final Set<String> GLUTEN =
        Set.of("Wheat", "Flour", "Bread", "Pasta", "Barley", "Rye", "Oats", "Crust");

    public static final Set<String> NUTS =
        Set.of("Almonds", "Walnuts", "Pecans", "Hazelnuts", "Peanuts", "Cashews", "Pistachios");

    public static final Set<String> DAIRY_AND_EGGS =
        Set.of("Milk", "Eggs", "Cheese", "Butter", "Cream", "Yogurt");

    public static final List<String> VEGETARIAN_REPLACEMENTS = List.of("Beans", "Mushrooms");

    public static final List<String> VEGAN_REPLACEMENTS = List.of("Almond Milk", "Flax Egg");

    private IngredientSubstitution() {}

    /**
     * Replace banned ingredients with at most {@code replacements.size()} substitutes.
     *
     * @param ingredients  the ingredient list, left untouched
     * @param banned       exact (case-sensitive) ingredient names to take out
     * @param replacements substitutes, consumed in order; may be empty
     * @return a new immutable list, never longer than {@code ingredients}
     */
    public static List<String> substitute(List<String> ingredients, Collection<String> banned,
                                          List<String> replacements) {
        var result = new ArrayList<String>(ingredients.size());
        int used = 0;
        for (String ingredient : ingredients) {
            if (!banned.contains(ingredient)) {
                result.add(ingredient);
            } else if (used < replacements.size()) {
                result.add(replacements.get(used++));
            }
        }
        return List.copyOf(result);
    }

    /**
     * Drop every banned ingredient without substitution.
     */
    public static List<String> remove(List<String> ingredients, Collection<String> banned) {
        return substitute(ingredients, banned, List.of());
    }
}
