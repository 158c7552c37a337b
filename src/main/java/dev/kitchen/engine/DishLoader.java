package dev.kitchen.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import dev.kitchen.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads dishes from comma-separated text with a header row.
 * <p>
 * Columns: kind, name, ingredients, prep time, price, cuisine, attributes. Ingredients
 * and attributes are {@code ;}-separated. Each line is one row, parsed on its own: a bad
 * row, including one with broken quoting, is skipped and reported by line number and never
 * stops the rest of the file from loading.
 */
public final class DishLoader {

    private static final Logger log = LoggerFactory.getLogger(DishLoader.class);

    private static final CsvMapper MAPPER = CsvMapper.builder()
        .enable(CsvParser.Feature.WRAP_AS_ARRAY)
        .build();

    static final int FIELD_COUNT = 7;
    static final int ATTRIBUTE_COUNT = 3;

    private DishLoader() {}

    /**
     * Load dishes from a CSV file.
     */
    public static LoadResult loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            LoadResult result = load(reader);
            log.info("Loaded {} dishes from {} ({} rows skipped)",
                result.dishes().size(), path, result.skipped().size());
            return result;
        }
    }

    /**
     * Load dishes from CSV text.
     */
    public static LoadResult loadFromString(String csv) throws IOException {
        return load(new StringReader(csv));
    }

    private static LoadResult load(Reader reader) throws IOException {
        var dishes = new ArrayList<Dish>();
        var skipped = new ArrayList<LoadResult.SkippedRow>();
        ObjectReader rowReader = MAPPER.readerFor(String[].class);

        var lines = new BufferedReader(reader);
        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 || line.isBlank()) {
                continue; // header, or nothing to load
            }
            try {
                String[] fields = rowReader.readValue(line);
                dishes.add(parseRow(fields));
            } catch (JsonProcessingException e) {
                skip(skipped, lineNumber, "Malformed CSV: " + e.getOriginalMessage());
            } catch (IllegalArgumentException e) {
                skip(skipped, lineNumber, e.getMessage());
            }
        }
        return new LoadResult(dishes, skipped);
    }

    private static void skip(List<LoadResult.SkippedRow> skipped, int line, String reason) {
        log.warn("Skipping line {}: {}", line, reason);
        skipped.add(new LoadResult.SkippedRow(line, reason));
    }

    static Dish parseRow(String[] fields) {
        if (fields.length < FIELD_COUNT) {
            throw new IllegalArgumentException("Expected %d fields, got %d".formatted(FIELD_COUNT, fields.length));
        }
        String kind = fields[0].trim();
        String name = fields[1].trim();
        List<String> ingredients = splitList(fields[2], ";");
        int prepTime = parseInt("prep time", fields[3]);
        double price = parseDouble("price", fields[4]);
        CuisineType cuisine = CuisineType.fromName(fields[5]);
        List<String> attributes = splitAttributes(fields[6]);

        if (attributes.size() < ATTRIBUTE_COUNT) {
            throw new IllegalArgumentException("Dish '%s' needs %d attributes, got %s"
                .formatted(name, ATTRIBUTE_COUNT, attributes));
        }

        return switch (kind) {
            case "APPETIZER" -> new Appetizer(name, ingredients, prepTime, price, cuisine,
                ServingStyle.fromName(attributes.get(0)),
                parseInt("spiciness level", attributes.get(1)),
                parseFlag(attributes.get(2)));
            case "MAINCOURSE" -> new MainCourse(name, ingredients, prepTime, price, cuisine,
                CookingMethod.fromName(attributes.get(0)),
                attributes.get(1),
                attributes.size() > ATTRIBUTE_COUNT ? parseSides(attributes.get(3)) : List.of(),
                parseFlag(attributes.get(2)));
            case "DESSERT" -> new Dessert(name, ingredients, prepTime, price, cuisine,
                FlavorProfile.fromName(attributes.get(0)),
                parseInt("sweetness level", attributes.get(1)),
                parseFlag(attributes.get(2)));
            default -> throw new IllegalArgumentException("Unknown dish kind: " + kind);
        };
    }

    /**
     * Sides are {@code |}-separated {@code name:CATEGORY} pairs, e.g. {@code Rice:GRAIN|Slaw:SALAD}.
     */
    static List<SideDish> parseSides(String text) {
        var sides = new ArrayList<SideDish>();
        for (String entry : splitList(text, "\\|")) {
            int colon = entry.indexOf(':');
            if (colon < 0) {
                sides.add(new SideDish(entry, SideCategory.fromName(null)));
            } else {
                sides.add(new SideDish(entry.substring(0, colon).trim(),
                    SideCategory.fromName(entry.substring(colon + 1))));
            }
        }
        return sides;
    }

    /**
     * Attributes are positional, so empty slots are kept as empty strings.
     */
    private static List<String> splitAttributes(String text) {
        var values = new ArrayList<String>();
        for (String token : text.split(";", -1)) {
            values.add(token.trim());
        }
        return values;
    }

    private static List<String> splitList(String text, String delimiterRegex) {
        var values = new ArrayList<String>();
        for (String token : text.split(delimiterRegex)) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    private static int parseInt(String field, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid %s '%s'".formatted(field, text));
        }
    }

    private static double parseDouble(String field, String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid %s '%s'".formatted(field, text));
        }
    }

    private static boolean parseFlag(String text) {
        return "true".equals(text.trim());
    }
}
