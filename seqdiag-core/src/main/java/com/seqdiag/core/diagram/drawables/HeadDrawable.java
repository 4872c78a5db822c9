package com.seqdiag.core.diagram.drawables;

import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;
import com.seqdiag.core.renderer.RenderAttributes;
import com.seqdiag.core.renderer.Renderer;

import java.util.Objects;

/**
 * The head of a lifeline: the figure and caption identifying an entity.
 *
 * <p>A head must be measured before it can be drawn; the attributes used for measuring are
 * also used for drawing.
 */
public abstract class HeadDrawable {

    private final String name;
    private RenderAttributes attributes;
    private Size size;

    protected HeadDrawable(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Measures this head.
     *
     * @param attributes render attributes
     * @return the head's size
     */
    public Size measure(RenderAttributes attributes) {
        this.attributes = Objects.requireNonNull(attributes, "attributes must not be null");
        this.size = computeSize(name, attributes);
        return size;
    }

    /**
     * Draws this head with its top edge centered at the given point.
     *
     * @param renderer target renderer
     * @param topCenter horizontal center and top edge
     * @throws IllegalStateException if the head has not been measured
     */
    public void draw(Renderer renderer, Point topCenter) {
        if (size == null) {
            throw new IllegalStateException("head '" + name + "' has not been measured");
        }
        drawAt(renderer, topCenter, size, name, attributes);
    }

    /**
     * Returns the size computed by the last {@link #measure(RenderAttributes)} call.
     *
     * @return measured size
     * @throws IllegalStateException if the head has not been measured
     */
    public Size getSize() {
        if (size == null) {
            throw new IllegalStateException("head '" + name + "' has not been measured");
        }
        return size;
    }

    protected abstract Size computeSize(String name, RenderAttributes attributes);

    protected abstract void drawAt(Renderer renderer, Point topCenter, Size size, String name,
                                   RenderAttributes attributes);
}
