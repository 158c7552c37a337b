package dev.kitchen.engine;

import dev.kitchen.model.CuisineType;
import dev.kitchen.model.DietaryRequest;
import dev.kitchen.model.Dish;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.function.Predicate;

/**
 * The order board. Owns the dishes and keeps the total prep time and the number of
 * elaborate dishes in step with every add, serve and dietary rewrite.
 * <p>
 * Single-threaded; callers sharing an instance must serialise access themselves.
 */
public final class Kitchen {

    private static final Logger log = LoggerFactory.getLogger(Kitchen.class);

    public static final int DEFAULT_CAPACITY = ArrayBag.DEFAULT_CAPACITY;

    private final ArrayBag<Dish> dishes;
    private int totalPrepTime;
    private int elaborateCount;

    public Kitchen() {
        this(DEFAULT_CAPACITY);
    }

    public Kitchen(int capacity) {
        this.dishes = new ArrayBag<>(capacity);
        this.totalPrepTime = 0;
        this.elaborateCount = 0;
    }

    public int size() { return dishes.size(); }
    public int capacity() { return dishes.capacity(); }
    public boolean isEmpty() { return dishes.isEmpty(); }
    public int totalPrepTime() { return totalPrepTime; }
    public int elaborateDishCount() { return elaborateCount; }

    public boolean contains(Dish dish) {
        return dishes.contains(dish);
    }

    /** Snapshot of the held dishes in current board order. */
    public List<Dish> dishes() {
        return dishes.toList();
    }

    /**
     * Put a dish on the board.
     *
     * @return false if the board is full
     */
    public boolean placeOrder(Dish dish) {
        if (!dishes.add(dish)) {
            log.warn("Board is full ({} dishes), rejected order for '{}'", dishes.capacity(), dish.name());
            return false;
        }
        track(dish);
        return true;
    }

    /**
     * Place each dish in turn. Stops accepting once the board is full but keeps going through the rest.
     *
     * @return number of dishes placed
     */
    public int placeOrders(Collection<? extends Dish> orders) {
        int placed = 0;
        for (Dish dish : orders) {
            if (placeOrder(dish)) {
                placed++;
            }
        }
        return placed;
    }

    /**
     * Take one dish equal to {@code dish} off the board. Equal dishes are interchangeable,
     * so which of several equal dishes leaves is unspecified.
     *
     * @return false if no equal dish is on the board
     */
    public boolean serveDish(Dish dish) {
        if (dishes.isEmpty() || !dishes.remove(dish)) {
            return false;
        }
        untrack(dish);
        return true;
    }

    /**
     * Rewrite every dish on the board for the request. Both aggregates are adjusted per dish,
     * since a substitution can shrink the ingredient list below the elaborate threshold.
     */
    public void applyDietaryAdjustmentToAll(DietaryRequest request) {
        log.debug("Applying {} to {} dishes", request, dishes.size());
        dishes.replaceAll(dish -> {
            Dish adjusted = dish.applyDietaryAccommodations(request);
            untrack(dish);
            track(adjusted);
            return adjusted;
        });
    }

    /** Rounded mean prep time, 0 when the board is empty. */
    public int averagePrepTime() {
        if (dishes.isEmpty()) {
            return 0;
        }
        return (int) Math.round((double) totalPrepTime / dishes.size());
    }

    /** Percentage of elaborate dishes rounded to two decimals, 0 when the board is empty. */
    public double elaboratePercentage() {
        if (dishes.isEmpty() || elaborateCount == 0) {
            return 0;
        }
        return Math.round((double) elaborateCount / dishes.size() * 10000) / 100.0;
    }

    public int countByCuisine(CuisineType cuisine) {
        int count = 0;
        for (Dish dish : dishes.toList()) {
            if (dish.cuisineType() == cuisine) {
                count++;
            }
        }
        return count;
    }

    /**
     * Serve every dish that takes strictly less than {@code threshold} minutes.
     *
     * @return number of dishes served
     */
    public int releaseBelowPrepTime(int threshold) {
        int served = releaseMatching(dish -> dish.prepTime() < threshold);
        log.debug("Released {} dishes below {} minutes", served, threshold);
        return served;
    }

    /**
     * Serve every dish of the given cuisine.
     *
     * @return number of dishes served
     */
    public int releaseByCuisine(CuisineType cuisine) {
        int served = releaseMatching(dish -> dish.cuisineType() == cuisine);
        log.debug("Released {} {} dishes", served, cuisine);
        return served;
    }

    public KitchenReport report() {
        var tally = new EnumMap<CuisineType, Integer>(CuisineType.class);
        for (CuisineType cuisine : CuisineType.values()) {
            tally.put(cuisine, 0);
        }
        for (Dish dish : dishes.toList()) {
            tally.merge(dish.cuisineType(), 1, Integer::sum);
        }
        return new KitchenReport(tally, dishes.size(), totalPrepTime,
            averagePrepTime(), elaborateCount, elaboratePercentage());
    }

    /** Every dish rendered for display, in board order. */
    public List<String> menu() {
        return dishes.toList().stream().map(DishFormatter::render).toList();
    }

    /**
     * Serve the matching dishes. The targets are collected first, because serving
     * moves the last dish into the freed slot.
     */
    private int releaseMatching(Predicate<Dish> predicate) {
        List<Dish> targets = dishes.toList().stream().filter(predicate).toList();
        int served = 0;
        for (Dish dish : targets) {
            if (serveDish(dish)) {
                served++;
            }
        }
        return served;
    }

    private void track(Dish dish) {
        totalPrepTime += dish.prepTime();
        if (dish.isElaborate()) {
            elaborateCount++;
        }
    }

    private void untrack(Dish dish) {
        totalPrepTime -= dish.prepTime();
        if (dish.isElaborate()) {
            elaborateCount--;
        }
    }
}
