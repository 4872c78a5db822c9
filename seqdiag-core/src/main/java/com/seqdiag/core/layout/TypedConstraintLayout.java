package com.seqdiag.core.layout;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ConstraintLayout} packing items left to right in their original order.
 *
 * <p>The first item starts at 0; every following item starts {@link LayoutOptions#itemMargin()}
 * after the previous item's right edge. Items are never reordered.
 *
 * <pre>{@code
 * ConstraintLayout<String> layout = new TypedConstraintLayout<>(List.of("A", "B"), new LayoutOptions(5));
 * layout.applyDimension("A", 10);
 * layout.applyDimension("B", 20);
 * ComputedLayout<String> result = layout.compute();
 * // A: 0..10, B: 15..35, total 35
 * }</pre>
 *
 * @param <T> item identifier type
 */
public class TypedConstraintLayout<T> implements ConstraintLayout<T> {

    private final List<T> items;
    private final LayoutOptions options;
    private final Map<T, Double> dimensions = new HashMap<>();

    /**
     * Creates a layout for the given items.
     *
     * @param items distinct item identifiers in layout order
     * @param options layout options
     * @throws IllegalArgumentException if the identifiers contain duplicates
     */
    public TypedConstraintLayout(List<T> items, LayoutOptions options) {
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Set<T> distinct = new LinkedHashSet<>(items);
        if (distinct.size() != items.size()) {
            throw new IllegalArgumentException("layout items must be distinct: " + items);
        }
        this.items = List.copyOf(items);
        this.options = options;
    }

    @Override
    public void applyDimension(T id, double dimension) {
        if (!items.contains(id)) {
            throw new IllegalArgumentException("unknown layout item: " + id);
        }
        if (dimension < 0 || Double.isNaN(dimension)) {
            throw new IllegalArgumentException("dimension must not be negative: " + dimension);
        }
        dimensions.put(id, dimension);
    }

    @Override
    public ComputedLayout<T> compute() {
        Map<T, ItemPosition> positions = new LinkedHashMap<>();
        double total = 0;
        double nextLeft = 0;

        for (T id : items) {
            double left = nextLeft;
            double right = left + dimensions.getOrDefault(id, 0.0);
            positions.put(id, ItemPosition.of(left, right));
            total = right;
            nextLeft = right + options.itemMargin();
        }

        return new ComputedLayout<>(total, positions);
    }
}
