package com.seqdiag.core.sequence;

import java.util.Objects;

/**
 * A participant of a sequence, rendered as a lifeline.
 *
 * @param type participant type
 * @param id unique identifier used to reference the entity in messages
 * @param name display label
 */
public record Entity(
    EntityType type,
    String id,
    String name
) {
    /**
     * Compact constructor with validation.
     */
    public Entity {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
