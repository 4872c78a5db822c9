package com.seqdiag.core.diagram.parts;

import com.seqdiag.core.renderer.Renderer;

/**
 * A visual part of a diagram that can draw itself once it has been laid out.
 */
public interface DiagramPart {

    /**
     * Draws this part.
     *
     * @param renderer target renderer
     */
    void draw(Renderer renderer);
}
