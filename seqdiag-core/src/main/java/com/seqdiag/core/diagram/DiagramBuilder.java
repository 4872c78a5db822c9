package com.seqdiag.core.diagram;

import com.seqdiag.core.diagram.parts.ActivationBarDiagramPart;
import com.seqdiag.core.diagram.parts.EntityDiagramPart;
import com.seqdiag.core.diagram.parts.MessageDiagramPart;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.sequence.Message;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single-use accumulator of diagram parts.
 *
 * <p>Parts are collected in the order they are added. {@link #build()} freezes them into an
 * immutable {@link DiagramParts}; the builder cannot be used afterwards.
 */
public class DiagramBuilder {

    private final Map<String, EntityDiagramPart> entities = new LinkedHashMap<>();
    private final List<MessageDiagramPart> messages = new ArrayList<>();
    private final List<ActivationBarDiagramPart> activationBars = new ArrayList<>();
    private boolean built;

    /**
     * Adds a part for the given entity.
     *
     * @param entity the entity
     * @return the created part
     * @throws IllegalArgumentException if an entity with the same id was already added
     */
    public EntityDiagramPart addEntity(Entity entity) {
        Objects.requireNonNull(entity, "entity must not be null");
        ensureNotBuilt();
        if (entities.containsKey(entity.id())) {
            throw new IllegalArgumentException("entity already added: " + entity.id());
        }
        EntityDiagramPart part = new EntityDiagramPart(entity);
        entities.put(entity.id(), part);
        return part;
    }

    /**
     * Adds a part for the given message, resolving its endpoints to entity parts.
     *
     * @param message the message
     * @return the created part
     * @throws IllegalArgumentException if an endpoint entity was not added before
     */
    public MessageDiagramPart addMessage(Message message) {
        Objects.requireNonNull(message, "message must not be null");
        ensureNotBuilt();
        MessageDiagramPart part = new MessageDiagramPart(message, partFor(message.from()), partFor(message.to()));
        messages.add(part);
        return part;
    }

    /**
     * Adds an activation bar.
     *
     * @param activation the activation covered by the bar
     * @param depth number of enclosing bars
     * @return the created part
     */
    public ActivationBarDiagramPart addActivationBar(Activation activation, int depth) {
        Objects.requireNonNull(activation, "activation must not be null");
        ensureNotBuilt();
        ActivationBarDiagramPart part = new ActivationBarDiagramPart(activation, depth);
        activationBars.add(part);
        return part;
    }

    /**
     * Freezes the accumulated parts.
     *
     * @return the parts in insertion order
     * @throws IllegalStateException if called more than once
     */
    public DiagramParts build() {
        ensureNotBuilt();
        built = true;
        return new DiagramParts(new ArrayList<>(entities.values()), messages, activationBars);
    }

    private EntityDiagramPart partFor(Entity entity) {
        if (entity == null) {
            return null;
        }
        EntityDiagramPart part = entities.get(entity.id());
        if (part == null) {
            throw new IllegalArgumentException("message references unknown entity: " + entity.id());
        }
        return part;
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("diagram builder has already been built");
        }
    }
}
