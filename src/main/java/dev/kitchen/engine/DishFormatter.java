package dev.kitchen.engine;

import dev.kitchen.model.Appetizer;
import dev.kitchen.model.Dessert;
import dev.kitchen.model.Dish;
import dev.kitchen.model.MainCourse;
import dev.kitchen.model.SideDish;

import java.util.Locale;

/**
 * Renders a dish as display text: the shared fields first, then the shape-specific ones.
 */
public final class DishFormatter {

    private DishFormatter() {}

    public static String render(Dish dish) {
        var sb = new StringBuilder();
        sb.append("Dish Name: ").append(dish.name()).append('\n');
        sb.append("Ingredients: ").append(String.join(", ", dish.ingredients())).append('\n');
        sb.append("Preparation Time: ").append(dish.prepTime()).append(" minutes\n");
        sb.append("Price: $").append(String.format(Locale.ROOT, "%.2f", dish.price())).append('\n');
        sb.append("Cuisine Type: ").append(dish.cuisineType().name()).append('\n');

        if (dish instanceof Appetizer appetizer) {
            appendAppetizer(sb, appetizer);
        } else if (dish instanceof MainCourse mainCourse) {
            appendMainCourse(sb, mainCourse);
        } else if (dish instanceof Dessert dessert) {
            appendDessert(sb, dessert);
        }
        return sb.toString();
    }

    private static void appendAppetizer(StringBuilder sb, Appetizer appetizer) {
        sb.append("Serving Style: ").append(appetizer.servingStyle().label()).append('\n');
        sb.append("Spiciness Level: ").append(appetizer.spicinessLevel()).append('\n');
        sb.append("Vegetarian: ").append(yesNo(appetizer.vegetarian()));
    }

    private static void appendMainCourse(StringBuilder sb, MainCourse mainCourse) {
        sb.append("Cooking Method: ").append(mainCourse.cookingMethod().label()).append('\n');
        sb.append("Protein Type: ").append(mainCourse.proteinType()).append('\n');
        sb.append("Side Dishes:");
        if (mainCourse.sideDishes().isEmpty()) {
            sb.append(" None");
        }
        for (SideDish side : mainCourse.sideDishes()) {
            sb.append('\n').append(side.name())
              .append(" (Category: ").append(side.category().label()).append(')');
        }
        sb.append('\n');
        sb.append("Gluten-Free: ").append(yesNo(mainCourse.glutenFree()));
    }

    private static void appendDessert(StringBuilder sb, Dessert dessert) {
        sb.append("Flavor Profile: ").append(dessert.flavorProfile().label()).append('\n');
        sb.append("Sweetness Level: ").append(dessert.sweetnessLevel()).append('\n');
        sb.append("Contains Nuts: ").append(yesNo(dessert.containsNuts()));
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }
}
