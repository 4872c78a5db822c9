package com.seqdiag.core.diagram.drawables;

import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;
import com.seqdiag.core.renderer.RenderAttributes;
import com.seqdiag.core.renderer.Renderer;

/**
 * Component head: the name inside a box.
 */
public class ComponentHeadDrawable extends HeadDrawable {

    private static final double PADDING_X = 10;
    private static final double PADDING_Y = 8;

    public ComponentHeadDrawable(String name) {
        super(name);
    }

    @Override
    protected Size computeSize(String name, RenderAttributes attributes) {
        Size text = attributes.measureText(name);
        return new Size(text.width() + 2 * PADDING_X, text.height() + 2 * PADDING_Y);
    }

    @Override
    protected void drawAt(Renderer renderer, Point topCenter, Size size, String name, RenderAttributes attributes) {
        renderer.drawRect(topCenter.translate(-size.width() / 2, 0), size);
        renderer.drawText(name, topCenter.translate(0, PADDING_Y), attributes);
    }
}
