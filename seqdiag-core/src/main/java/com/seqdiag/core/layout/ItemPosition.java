package com.seqdiag.core.layout;

/**
 * Computed extent of one item along the layout axis.
 *
 * @param left leading edge
 * @param right trailing edge
 * @param center midpoint of {@code left} and {@code right}
 */
public record ItemPosition(double left, double right, double center) {

    /**
     * Creates a position from its edges.
     *
     * @param left leading edge
     * @param right trailing edge
     * @return the position, with its center derived from the edges
     */
    public static ItemPosition of(double left, double right) {
        return new ItemPosition(left, right, (left + right) / 2);
    }
}
