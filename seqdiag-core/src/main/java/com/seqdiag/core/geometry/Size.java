package com.seqdiag.core.geometry;

/**
 * Width and height of a rectangular area.
 *
 * @param width horizontal extent, non-negative
 * @param height vertical extent, non-negative
 */
public record Size(double width, double height) {

    /**
     * Compact constructor with validation.
     */
    public Size {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("size must not be negative: " + width + "x" + height);
        }
    }
}
