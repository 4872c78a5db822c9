package com.seqdiag.core.renderer;

import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;

/**
 * Sink for drawing primitives.
 *
 * <p>Diagram parts draw themselves by calling these methods; implementations decide what the
 * primitives turn into (SVG elements, canvas calls, ...).
 *
 * @see com.seqdiag.core.renderer.impl.SvgRenderer
 */
public interface Renderer {

    /**
     * Draws a straight line.
     */
    void drawLine(Point from, Point to, LineStyle style);

    /**
     * Draws an outlined rectangle.
     *
     * @param topLeft top left corner
     * @param size rectangle size
     */
    void drawRect(Point topLeft, Size size);

    /**
     * Draws an outlined circle.
     */
    void drawCircle(Point center, double radius);

    /**
     * Draws a single line of text.
     *
     * @param text the text
     * @param topCenter horizontal center and top edge of the text
     * @param attributes font attributes
     */
    void drawText(String text, Point topCenter, RenderAttributes attributes);
}
