package com.seqdiag.core.diagram;

import com.seqdiag.core.config.DiagramConfig;
import com.seqdiag.core.diagram.parts.ActivationBarDiagramPart;
import com.seqdiag.core.diagram.parts.EntityDiagramPart;
import com.seqdiag.core.diagram.parts.MessageDiagramPart;
import com.seqdiag.core.geometry.Point;
import com.seqdiag.core.geometry.Size;
import com.seqdiag.core.layout.ComputedLayout;
import com.seqdiag.core.layout.ConstraintLayout;
import com.seqdiag.core.layout.ItemPosition;
import com.seqdiag.core.layout.LayoutOptions;
import com.seqdiag.core.layout.TypedConstraintLayout;
import com.seqdiag.core.renderer.RenderAttributes;
import com.seqdiag.core.renderer.Renderer;
import com.seqdiag.core.sequence.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The visual parts of a sequence diagram.
 *
 * <p>Unlike a {@link Sequence}, a diagram does not keep message hierarchies; it holds the flat
 * parts that are laid out and drawn. Usage is two-phase: {@link #layout(RenderAttributes)}
 * computes all positions, after which {@link #draw(Renderer)} may be called.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Diagram diagram = Diagram.create(sequence, DiagramConfig.defaults());
 * diagram.layout(attributes);
 * diagram.draw(renderer);
 * }</pre>
 */
public class Diagram {

    private static final Logger log = LoggerFactory.getLogger(Diagram.class);

    private final List<EntityDiagramPart> entities;
    private final List<MessageDiagramPart> messages;
    private final List<ActivationBarDiagramPart> activationBars;
    private final DiagramConfig config;

    private final ConstraintLayout<String> horizontalLayout;
    private Size computedSize;

    private Diagram(DiagramParts parts, DiagramConfig config) {
        this.entities = parts.entities();
        this.messages = parts.messages();
        this.activationBars = parts.activationBars();
        this.config = config;

        List<String> entityIds = entities.stream().map(e -> e.getEntity().id()).toList();
        this.horizontalLayout = new TypedConstraintLayout<>(entityIds, new LayoutOptions(config.entitySpacing()));
    }

    /**
     * Builds a diagram from a fully valid sequence.
     *
     * @param sequence the sequence to visualize
     * @param config diagram settings
     * @return the diagram
     */
    public static Diagram create(Sequence sequence, DiagramConfig config) {
        Objects.requireNonNull(sequence, "sequence must not be null");
        Objects.requireNonNull(config, "config must not be null");

        DiagramBuilder builder = new DiagramBuilder();
        sequence.entities().forEach(builder::addEntity);

        DiagramActivationWalker walker = new DiagramActivationWalker(builder);
        sequence.activations().forEach(walker::walk);

        DiagramParts parts = builder.build();
        log.debug("Built diagram with {} entities, {} messages and {} activation bars",
            parts.entities().size(), parts.messages().size(), parts.activationBars().size());
        return new Diagram(parts, config);
    }

    /**
     * Lays out all parts and computes the overall diagram size.
     *
     * @param attributes render attributes used to measure text
     */
    public void layout(RenderAttributes attributes) {
        Objects.requireNonNull(attributes, "attributes must not be null");

        for (EntityDiagramPart entity : entities) {
            Size head = entity.measureHead(attributes);
            horizontalLayout.applyDimension(entity.getEntity().id(), head.width());
        }

        ComputedLayout<String> computed = horizontalLayout.compute();

        // TODO replace the placeholder height once messages and activation bars are laid out vertically
        double height = config.placeholderHeight();
        this.computedSize = new Size(computed.totalDimensions(), height);

        for (EntityDiagramPart entity : entities) {
            ItemPosition position = computed.get(entity.getEntity().id());
            entity.setTopCenter(new Point(position.center(), 0));
            entity.setLifelineEnd(height);
        }
        log.debug("Laid out diagram: {}x{}", computedSize.width(), computedSize.height());
    }

    /**
     * Returns the size of the surface needed to draw the diagram.
     *
     * @return the diagram size
     * @throws IllegalStateException if {@link #layout(RenderAttributes)} has not been called
     */
    public Size getComputedSize() {
        ensureLaidOut();
        return computedSize;
    }

    /**
     * Draws the diagram. Only entities (heads and lifelines) are drawn for now.
     *
     * @param renderer target renderer
     * @throws IllegalStateException if {@link #layout(RenderAttributes)} has not been called
     */
    public void draw(Renderer renderer) {
        Objects.requireNonNull(renderer, "renderer must not be null");
        ensureLaidOut();
        entities.forEach(entity -> entity.draw(renderer));
    }

    public List<EntityDiagramPart> getEntities() {
        return entities;
    }

    public List<MessageDiagramPart> getMessages() {
        return messages;
    }

    public List<ActivationBarDiagramPart> getActivationBars() {
        return activationBars;
    }

    private void ensureLaidOut() {
        if (computedSize == null) {
            throw new IllegalStateException("layout not yet computed");
        }
    }
}
