package com.seqdiag.core.geometry;

/**
 * A point on the drawing surface.
 *
 * @param x horizontal coordinate, growing to the right
 * @param y vertical coordinate, growing downwards
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    /**
     * Returns this point moved by the given offsets.
     *
     * @param dx horizontal offset
     * @param dy vertical offset
     * @return translated point
     */
    public Point translate(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }
}
