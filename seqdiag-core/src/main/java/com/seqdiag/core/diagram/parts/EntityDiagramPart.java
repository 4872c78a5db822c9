package com.seqdiag.core.diagram.parts;

import com.seqdiag.core.diagram.drawables.ActorHeadDrawable;
import com.seqdiag.core.diagram.drawables.ComponentHeadDrawable;
import com.seqdiag.core.diagram.drawables.HeadDrawable;
import com.seqdiag.core.diagram.drawables.LifelineDrawable;
import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;
import com.seqdiag.core.renderer.RenderAttributes;
import com.seqdiag.core.renderer.Renderer;
import com.seqdiag.core.sequence.Entity;

import java.util.Objects;

/**
 * A diagram part representing an entity: its head and lifeline.
 */
public class EntityDiagramPart implements DiagramPart {

    private final Entity entity;
    private final LifelineDrawable drawable;
    private Point topCenter = Point.ORIGIN;
    private double lifelineEndY;

    public EntityDiagramPart(Entity entity) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.drawable = new LifelineDrawable(headFor(entity));
    }

    private static HeadDrawable headFor(Entity entity) {
        return switch (entity.type()) {
            case ACTOR -> new ActorHeadDrawable(entity.name());
            case COMPONENT -> new ComponentHeadDrawable(entity.name());
        };
    }

    public Entity getEntity() {
        return entity;
    }

    /**
     * Measures the head of this entity.
     *
     * @param attributes render attributes
     * @return the head size
     */
    public Size measureHead(RenderAttributes attributes) {
        return drawable.measureHead(attributes);
    }

    /**
     * Sets the position of this entity.
     *
     * <p>The x coordinate is the center of the lifeline; the y coordinate is the top of the head.
     *
     * @param topCenter the position
     */
    public void setTopCenter(Point topCenter) {
        this.topCenter = Objects.requireNonNull(topCenter, "topCenter must not be null");
    }

    public Point getTopCenter() {
        return topCenter;
    }

    /**
     * Sets the absolute y coordinate at which the lifeline stops.
     *
     * @param endY end of the lifeline
     */
    public void setLifelineEnd(double endY) {
        this.lifelineEndY = endY;
    }

    public double getLifelineEnd() {
        return lifelineEndY;
    }

    @Override
    public void draw(Renderer renderer) {
        drawable.setTopCenter(topCenter);
        drawable.setEndHeight(lifelineEndY);
        drawable.draw(renderer);
    }
}
