package com.seqdiag.core.diagram.drawables;

import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;
import com.seqdiag.core.renderer.LineStyle;
import com.seqdiag.core.renderer.RenderAttributes;
import com.seqdiag.core.renderer.Renderer;

import java.util.Objects;

/**
 * A head followed by a dashed vertical line down to an absolute end height.
 */
public class LifelineDrawable {

    private final HeadDrawable head;
    private Point topCenter = Point.ORIGIN;
    private double endHeight;

    public LifelineDrawable(HeadDrawable head) {
        this.head = Objects.requireNonNull(head, "head must not be null");
    }

    public Size measureHead(RenderAttributes attributes) {
        return head.measure(attributes);
    }

    public void setTopCenter(Point topCenter) {
        this.topCenter = Objects.requireNonNull(topCenter, "topCenter must not be null");
    }

    public void setEndHeight(double endHeight) {
        this.endHeight = endHeight;
    }

    public void draw(Renderer renderer) {
        head.draw(renderer, topCenter);

        double lineStart = topCenter.y() + head.getSize().height();
        if (endHeight > lineStart) {
            renderer.drawLine(new Point(topCenter.x(), lineStart), new Point(topCenter.x(), endHeight), LineStyle.DASHED);
        }
    }
}
