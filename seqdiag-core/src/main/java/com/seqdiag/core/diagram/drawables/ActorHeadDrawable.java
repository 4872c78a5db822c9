package com.seqdiag.core.diagram.drawables;

import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;
import com.seqdiag.core.renderer.LineStyle;
import com.seqdiag.core.renderer.RenderAttributes;
import com.seqdiag.core.renderer.Renderer;

/**
 * Actor head: a stick figure with the name as caption below it.
 */
public class ActorHeadDrawable extends HeadDrawable {

    private static final double HEAD_RADIUS = 8;
    private static final double FIGURE_WIDTH = 24;
    private static final double FIGURE_HEIGHT = 36;
    private static final double CAPTION_GAP = 4;

    public ActorHeadDrawable(String name) {
        super(name);
    }

    @Override
    protected Size computeSize(String name, RenderAttributes attributes) {
        Size text = attributes.measureText(name);
        return new Size(Math.max(FIGURE_WIDTH, text.width()), FIGURE_HEIGHT + CAPTION_GAP + text.height());
    }

    @Override
    protected void drawAt(Renderer renderer, Point topCenter, Size size, String name, RenderAttributes attributes) {
        double x = topCenter.x();
        double top = topCenter.y();
        double halfWidth = FIGURE_WIDTH / 2;

        renderer.drawCircle(new Point(x, top + HEAD_RADIUS), HEAD_RADIUS);
        // body, arms, legs
        renderer.drawLine(new Point(x, top + 2 * HEAD_RADIUS), new Point(x, top + 28), LineStyle.SOLID);
        renderer.drawLine(new Point(x - halfWidth, top + 20), new Point(x + halfWidth, top + 20), LineStyle.SOLID);
        renderer.drawLine(new Point(x, top + 28), new Point(x - 10, top + FIGURE_HEIGHT), LineStyle.SOLID);
        renderer.drawLine(new Point(x, top + 28), new Point(x + 10, top + FIGURE_HEIGHT), LineStyle.SOLID);

        renderer.drawText(name, new Point(x, top + FIGURE_HEIGHT + CAPTION_GAP), attributes);
    }
}
