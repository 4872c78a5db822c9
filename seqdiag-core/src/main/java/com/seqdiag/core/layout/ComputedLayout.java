package com.seqdiag.core.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of {@link ConstraintLayout#compute()}.
 *
 * @param totalDimensions overall extent containing every item
 * @param items item positions, iterating in the layout's item order
 * @param <T> item identifier type
 */
public record ComputedLayout<T>(
    double totalDimensions,
    Map<T, ItemPosition> items
) {
    /**
     * Compact constructor with validation.
     */
    public ComputedLayout {
        Objects.requireNonNull(items, "items must not be null");
        items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    /**
     * Returns the position of an item.
     *
     * @param id item identifier
     * @return the item's position
     * @throws IllegalArgumentException if the item is not part of the layout
     */
    public ItemPosition get(T id) {
        ItemPosition position = items.get(id);
        if (position == null) {
            throw new IllegalArgumentException("no position computed for item: " + id);
        }
        return position;
    }
}
