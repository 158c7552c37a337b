package dev.kitchen.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IngredientSubstitutionTest {

    @Test
    void replacesFirstTwoMatchesAndDropsTheRest() {
        var result = IngredientSubstitution.substitute(
            List.of("Meat", "Fish", "Chicken", "Rice"),
            IngredientSubstitution.NON_VEGETARIAN,
            IngredientSubstitution.VEGETARIAN_REPLACEMENTS);

        assertThat(result).containsExactly("Beans", "Mushrooms", "Rice");
    }

    @Test
    void keepsOrderOfSurvivorsAroundReplacements() {
        var result = IngredientSubstitution.substitute(
            List.of("Onion", "Bacon", "Garlic", "Pork", "Salt", "Lamb"),
            IngredientSubstitution.NON_VEGETARIAN,
            IngredientSubstitution.VEGETARIAN_REPLACEMENTS);

        assertThat(result).containsExactly("Onion", "Beans", "Garlic", "Mushrooms", "Salt");
    }

    @Test
    void singleMatchUsesOnlyFirstReplacement() {
        var result = IngredientSubstitution.substitute(
            List.of("Sugar", "Milk"),
            IngredientSubstitution.DAIRY_AND_EGGS,
            IngredientSubstitution.VEGAN_REPLACEMENTS);

        assertThat(result).containsExactly("Sugar", "Almond Milk");
    }

    @Test
    void repeatedBannedIngredientCountsAsSeparateMatches() {
        var result = IngredientSubstitution.substitute(
            List.of("Eggs", "Eggs", "Eggs"),
            IngredientSubstitution.DAIRY_AND_EGGS,
            IngredientSubstitution.VEGAN_REPLACEMENTS);

        assertThat(result).containsExactly("Almond Milk", "Flax Egg");
    }

    @Test
    void removalWithoutReplacement() {
        var result = IngredientSubstitution.remove(
            List.of("Flour", "Rice", "Bread"), IngredientSubstitution.GLUTEN);

        assertThat(result).containsExactly("Rice");
    }

    @Test
    void matchingIsCaseSensitive() {
        var result = IngredientSubstitution.remove(List.of("flour", "Flour"), Set.of("Flour"));

        assertThat(result).containsExactly("flour");
    }

    @Test
    void leavesInputUntouched() {
        var input = List.of("Beef", "Rice");

        IngredientSubstitution.substitute(input, IngredientSubstitution.NON_VEGETARIAN, List.of("Beans"));

        assertThat(input).containsExactly("Beef", "Rice");
    }

    @Test
    void emptyInputGivesEmptyResult() {
        assertThat(IngredientSubstitution.remove(List.of(), IngredientSubstitution.NUTS)).isEmpty();
    }
}
