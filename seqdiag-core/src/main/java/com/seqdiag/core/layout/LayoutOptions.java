package com.seqdiag.core.layout;

/**
 * Options for a {@link ConstraintLayout}.
 *
 * @param itemMargin minimum gap between the right edge of one item and the left edge of the next
 */
public record LayoutOptions(double itemMargin) {

    /**
     * Compact constructor with validation.
     */
    public LayoutOptions {
        if (itemMargin < 0 || Double.isNaN(itemMargin)) {
            throw new IllegalArgumentException("itemMargin must not be negative: " + itemMargin);
        }
    }
}
