package dev.kitchen.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DishTest {

    @Test
    void elaborateNeedsFiveIngredientsAndAnHour() {
        var five = List.of("A", "B", "C", "D", "E");

        assertThat(dessert(five, 60).isElaborate()).isTrue();
        assertThat(dessert(five, 59).isElaborate()).isFalse();
        assertThat(dessert(List.of("A", "B", "C", "D"), 120).isElaborate()).isFalse();
    }

    @Test
    void equalityIsByAttributes() {
        assertThat(dessert(List.of("Sugar"), 10)).isEqualTo(dessert(List.of("Sugar"), 10));
        assertThat(dessert(List.of("Sugar"), 10)).isNotEqualTo(dessert(List.of("Sugar"), 11));
    }

    @Test
    void dishesOfDifferentShapeAreNeverEqual() {
        var appetizer = new Appetizer("Plate", List.of("Sugar"), 10, 5.0, CuisineType.OTHER,
            ServingStyle.PLATED, 0, false);

        assertThat((Dish) appetizer).isNotEqualTo(dessert(List.of("Sugar"), 10));
    }

    @Test
    void ingredientsAreCopied() {
        var source = new ArrayList<>(List.of("Sugar"));
        Dessert dessert = dessert(source, 10);

        source.add("Salt");

        assertThat(dessert.ingredients()).containsExactly("Sugar");
    }

    @Test
    void rejectsNegativePrepTimeAndPrice() {
        assertThatThrownBy(() -> dessert(List.of(), -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("prepTime");
        assertThatThrownBy(() -> new Dessert("Cake", List.of(), 10, -0.5, CuisineType.OTHER,
            FlavorProfile.SWEET, 0, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("price");
    }

    @Test
    void rejectsBlankName() {
        assertThatThrownBy(() -> new Appetizer(" ", List.of(), 10, 1.0, CuisineType.OTHER,
            ServingStyle.PLATED, 0, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownEnumNamesFallBackToDefaults() {
        assertThat(CuisineType.fromName("KOREAN")).isEqualTo(CuisineType.OTHER);
        assertThat(CuisineType.fromName("italian")).isEqualTo(CuisineType.ITALIAN);
        assertThat(ServingStyle.fromName("TAPAS")).isEqualTo(ServingStyle.PLATED);
        assertThat(CookingMethod.fromName("SMOKED")).isEqualTo(CookingMethod.GRILLED);
        assertThat(FlavorProfile.fromName(null)).isEqualTo(FlavorProfile.SWEET);
        assertThat(SideCategory.fromName("NOODLES")).isEqualTo(SideCategory.GRAIN);
    }

    private static Dessert dessert(List<String> ingredients, int prepTime) {
        return new Dessert("Cake", ingredients, prepTime, 5.0, CuisineType.OTHER, FlavorProfile.SWEET, 3, false);
    }
}
