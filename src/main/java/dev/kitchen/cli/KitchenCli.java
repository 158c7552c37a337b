package dev.kitchen.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.kitchen.engine.DishLoader;
import dev.kitchen.engine.Kitchen;
import dev.kitchen.engine.LoadResult;
import dev.kitchen.model.CuisineType;
import dev.kitchen.model.DietaryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point: load a dish file onto the board, adjust and release dishes, then print.
 * Steps run in a fixed order: load, diet, release below, release cuisine, menu, report.
 */
@Command(
    name = "kitchen-board",
    mixinStandardHelpOptions = true,
    description = "Load dishes onto a kitchen order board, adjust them for dietary needs and report."
)
public class KitchenCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(KitchenCli.class);

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "CSV file of dishes (with a header row)")
    private Path file;

    @Option(names = "--capacity", defaultValue = "" + Kitchen.DEFAULT_CAPACITY,
        description = "Maximum number of dishes on the board (default: ${DEFAULT-VALUE})")
    private int capacity;

    @Option(names = "--diet", converter = DietaryRequestConverter.class,
        description = "Comma-separated dietary flags: vegetarian, vegan, gluten-free, nut-free, low-sodium, low-sugar")
    private DietaryRequest diet;

    @Option(names = "--release-below", paramLabel = "MINUTES",
        description = "Serve every dish that takes less than MINUTES to prepare")
    private Integer releaseBelow;

    @Option(names = "--release-cuisine", paramLabel = "CUISINE",
        description = "Serve every dish of this cuisine (unknown names mean OTHER)")
    private String releaseCuisine;

    @Option(names = "--menu", description = "Print every dish on the board")
    private boolean menu;

    @Option(names = "--report", description = "Print the cuisine tally and averages (default when --menu is not given)")
    private boolean report;

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    @Option(names = "--verbose", description = "Log board operations")
    private boolean verbose;

    @Override
    public Integer call() {
        if (capacity < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "--capacity must be >= 0, got " + capacity);
        }
        if (verbose) {
            enableDebugLogging();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        LoadResult loaded;
        try {
            loaded = DishLoader.loadFromFile(file);
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        }
        for (LoadResult.SkippedRow row : loaded.skipped()) {
            err.println("Skipped line %d: %s".formatted(row.line(), row.reason()));
        }

        var kitchen = new Kitchen(capacity);
        int placed = kitchen.placeOrders(loaded.dishes());
        if (placed < loaded.dishes().size()) {
            err.println("Board full: %d of %d dishes placed".formatted(placed, loaded.dishes().size()));
        }

        if (diet != null && !diet.isEmpty()) {
            kitchen.applyDietaryAdjustmentToAll(diet);
        }
        if (releaseBelow != null) {
            int served = kitchen.releaseBelowPrepTime(releaseBelow);
            out.println("Served %d dishes under %d minutes".formatted(served, releaseBelow));
        }
        if (releaseCuisine != null) {
            CuisineType cuisine = CuisineType.fromName(releaseCuisine);
            int served = kitchen.releaseByCuisine(cuisine);
            out.println("Served %d %s dishes".formatted(served, cuisine));
        }

        if (menu) {
            for (String dish : kitchen.menu()) {
                out.println(dish);
                out.println();
            }
        }
        if (report || json || !menu) {
            if (json) {
                try {
                    out.println(JSON.writeValueAsString(kitchen.report()));
                } catch (JsonProcessingException e) {
                    err.println("Error: cannot write report: " + e.getMessage());
                    return 1;
                }
            } else {
                out.println(kitchen.report().render());
            }
        }
        out.flush();
        log.debug("Board finished with {} dishes, {} minutes total", kitchen.size(), kitchen.totalPrepTime());
        return 0;
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(Level.DEBUG);
        }
    }

    public static class DietaryRequestConverter implements CommandLine.ITypeConverter<DietaryRequest> {
        @Override
        public DietaryRequest convert(String value) {
            return DietaryRequest.parse(value);
        }
    }
}
