package dev.kitchen.engine;

import dev.kitchen.model.Dish;

import java.util.List;

/**
 * Outcome of loading a dish file: the dishes that parsed, and why the others did not.
 */
public record LoadResult(List<Dish> dishes, List<SkippedRow> skipped) {

    public LoadResult {
        dishes = List.copyOf(dishes);
        skipped = List.copyOf(skipped);
    }

    /** A data row that was left out, by its physical line in the file (the header is line 1). */
    public record SkippedRow(int line, String reason) {}
}
