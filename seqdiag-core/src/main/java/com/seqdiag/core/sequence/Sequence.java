package com.seqdiag.core.sequence;

import java.util.List;
import java.util.Objects;

/**
 * A fully parsed sequence: the declared entities and the root activations.
 *
 * @param entities entities in declaration order, unique by id
 * @param activations root activations in source order
 */
public record Sequence(
    List<Entity> entities,
    List<Activation> activations
) {
    /**
     * Compact constructor with validation.
     */
    public Sequence {
        Objects.requireNonNull(entities, "entities must not be null");
        Objects.requireNonNull(activations, "activations must not be null");
        entities = List.copyOf(entities);
        activations = List.copyOf(activations);
    }
}
