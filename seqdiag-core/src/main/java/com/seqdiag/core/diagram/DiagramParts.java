package com.seqdiag.core.diagram;

import com.seqdiag.core.diagram.parts.ActivationBarDiagramPart;
import com.seqdiag.core.diagram.parts.EntityDiagramPart;
import com.seqdiag.core.diagram.parts.MessageDiagramPart;

import java.util.List;
import java.util.Objects;

/**
 * The parts produced by a {@link DiagramBuilder}, each list in render order.
 *
 * @param entities entity parts in declaration order
 * @param messages message parts in depth-first pre-order
 * @param activationBars activation bars in depth-first pre-order
 */
public record DiagramParts(
    List<EntityDiagramPart> entities,
    List<MessageDiagramPart> messages,
    List<ActivationBarDiagramPart> activationBars
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramParts {
        Objects.requireNonNull(entities, "entities must not be null");
        Objects.requireNonNull(messages, "messages must not be null");
        Objects.requireNonNull(activationBars, "activationBars must not be null");
        entities = List.copyOf(entities);
        messages = List.copyOf(messages);
        activationBars = List.copyOf(activationBars);
    }
}
