package dev.kitchen.engine;

import dev.kitchen.model.CuisineType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Point-in-time summary of the kitchen.
 *
 * @param cuisineTally        dishes per cuisine, every cuisine present, in declaration order
 * @param averagePrepTime     rounded mean prep time in minutes, 0 when empty
 * @param elaboratePercentage share of elaborate dishes, two decimals, 0 when empty
 */
public record KitchenReport(
    Map<CuisineType, Integer> cuisineTally,
    int dishCount,
    int totalPrepTime,
    int averagePrepTime,
    int elaborateCount,
    double elaboratePercentage
) {

    public KitchenReport {
        var tally = new EnumMap<CuisineType, Integer>(CuisineType.class);
        tally.putAll(cuisineTally);
        cuisineTally = Collections.unmodifiableMap(tally);
    }

    /**
     * Plain-text rendering: one line per cuisine, a blank line, then the averages.
     */
    public String render() {
        var sb = new StringBuilder();
        for (CuisineType cuisine : CuisineType.values()) {
            sb.append(cuisine.name()).append(": ")
              .append(cuisineTally.getOrDefault(cuisine, 0)).append('\n');
        }
        sb.append('\n');
        sb.append("AVERAGE PREP TIME: ").append(averagePrepTime).append('\n');
        sb.append("ELABORATE DISHES: ").append(formatPercentage(elaboratePercentage)).append('%');
        return sb.toString();
    }

    private static String formatPercentage(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
