package dev.kitchen.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Fixed-capacity unordered multiset kept dense in a list.
 * <p>
 * Membership is decided by {@link Object#equals}. Removing an item moves the last
 * item into the vacated slot, so the order of held items changes on removal.
 * Not thread-safe.
 */
public final class ArrayBag<T> {

    public static final int DEFAULT_CAPACITY = 100;

    private final List<T> items;
    private final int capacity;

    public ArrayBag() {
        this(DEFAULT_CAPACITY);
    }

    public ArrayBag(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayList<>(capacity);
    }

    public int size() { return items.size(); }
    public int capacity() { return capacity; }
    public boolean isEmpty() { return items.isEmpty(); }
    public boolean isFull() { return items.size() == capacity; }

    /**
     * Insert into the next free slot.
     *
     * @return false if the bag is full
     */
    public boolean add(T item) {
        Objects.requireNonNull(item, "item");
        if (isFull()) {
            return false;
        }
        items.add(item);
        return true;
    }

    /**
     * Remove one occurrence equal to {@code item}.
     *
     * @return false if no equal item is held
     */
    public boolean remove(T item) {
        int index = item == null ? -1 : items.indexOf(item);
        if (index < 0) {
            return false;
        }
        T last = items.remove(items.size() - 1);
        if (index < items.size()) {
            items.set(index, last);
        }
        return true;
    }

    public boolean contains(T item) {
        return item != null && items.contains(item);
    }

    /**
     * Replace every held item, in slot order, with the operator's result. Slots keep their positions.
     */
    public void replaceAll(UnaryOperator<T> operator) {
        items.replaceAll(item -> Objects.requireNonNull(operator.apply(item), "replacement"));
    }

    /**
     * Snapshot of the held items in current slot order. Later mutations of the bag do not affect it.
     */
    public List<T> toList() {
        return new ArrayList<>(items);
    }
}
