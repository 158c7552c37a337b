package dev.kitchen.engine;

import dev.kitchen.model.CuisineType;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KitchenReportTest {

    @Test
    void rendersTallyThenAverages() {
        var tally = new EnumMap<CuisineType, Integer>(CuisineType.class);
        tally.put(CuisineType.ITALIAN, 2);
        tally.put(CuisineType.OTHER, 1);

        var report = new KitchenReport(tally, 3, 90, 30, 1, 33.33);

        assertThat(report.render()).isEqualTo("""
            ITALIAN: 2
            MEXICAN: 0
            CHINESE: 0
            INDIAN: 0
            AMERICAN: 0
            FRENCH: 0
            OTHER: 1

            AVERAGE PREP TIME: 30
            ELABORATE DISHES: 33.33%""");
    }

    @Test
    void wholePercentagesHaveNoDecimals() {
        var report = new KitchenReport(Map.of(CuisineType.FRENCH, 8), 8, 400, 50, 2, 25.0);

        assertThat(report.render()).endsWith("ELABORATE DISHES: 25%");
    }

    @Test
    void tallyKeepsCuisineOrder() {
        var report = new KitchenReport(Map.of(CuisineType.OTHER, 1, CuisineType.ITALIAN, 2), 3, 0, 0, 0, 0);

        assertThat(report.cuisineTally().keySet()).containsExactly(CuisineType.ITALIAN, CuisineType.OTHER);
    }
}
