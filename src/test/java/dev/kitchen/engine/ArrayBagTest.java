package dev.kitchen.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArrayBagTest {

    @Test
    void startsEmptyWithDefaultCapacity() {
        var bag = new ArrayBag<String>();

        assertThat(bag.isEmpty()).isTrue();
        assertThat(bag.size()).isZero();
        assertThat(bag.capacity()).isEqualTo(ArrayBag.DEFAULT_CAPACITY);
    }

    @Test
    void addFailsOnceFull() {
        var bag = new ArrayBag<String>(2);

        assertThat(bag.add("a")).isTrue();
        assertThat(bag.add("b")).isTrue();
        assertThat(bag.isFull()).isTrue();
        assertThat(bag.add("c")).isFalse();
        assertThat(bag.size()).isEqualTo(2);
        assertThat(bag.contains("c")).isFalse();
    }

    @Test
    void removeTakesExactlyOneEqualItem() {
        var bag = new ArrayBag<String>(5);
        bag.add("x");
        bag.add("y");
        bag.add("x");

        assertThat(bag.remove(new String("x"))).isTrue();

        assertThat(bag.size()).isEqualTo(2);
        assertThat(bag.toList()).containsExactlyInAnyOrder("x", "y");
    }

    @Test
    void removeOfAbsentItemLeavesBagUnchanged() {
        var bag = new ArrayBag<String>(3);
        bag.add("a");

        assertThat(bag.remove("z")).isFalse();
        assertThat(bag.remove(null)).isFalse();
        assertThat(bag.toList()).containsExactly("a");
    }

    @Test
    void removalMovesLastItemIntoFreedSlot() {
        var bag = new ArrayBag<String>(4);
        bag.add("a");
        bag.add("b");
        bag.add("c");
        bag.add("d");

        bag.remove("a");

        assertThat(bag.toList()).containsExactly("d", "b", "c");
    }

    @Test
    void freedSlotCanBeReused() {
        var bag = new ArrayBag<String>(1);
        bag.add("a");
        bag.remove("a");

        assertThat(bag.add("b")).isTrue();
        assertThat(bag.toList()).containsExactly("b");
    }

    @Test
    void snapshotIsDetachedFromBag() {
        var bag = new ArrayBag<String>(3);
        bag.add("a");
        var snapshot = bag.toList();

        bag.add("b");
        bag.remove("a");

        assertThat(snapshot).containsExactly("a");
    }

    @Test
    void replaceAllKeepsSlots() {
        var bag = new ArrayBag<String>(3);
        bag.add("a");
        bag.add("b");

        bag.replaceAll(String::toUpperCase);

        assertThat(bag.toList()).containsExactly("A", "B");
    }

    @Test
    void removingLastItemLeavesOthersInPlace() {
        var bag = new ArrayBag<String>(3);
        bag.add("a");
        bag.add("b");
        bag.add("c");

        bag.remove("c");

        assertThat(bag.toList()).containsExactly("a", "b");
    }

    @Test
    void rejectsNullItemAndNegativeCapacity() {
        assertThatThrownBy(() -> new ArrayBag<String>(1).add(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ArrayBag<String>(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroCapacityBagIsEmptyAndFull() {
        var bag = new ArrayBag<String>(0);

        assertThat(bag.isEmpty()).isTrue();
        assertThat(bag.isFull()).isTrue();
        assertThat(bag.add("a")).isFalse();
    }
}
