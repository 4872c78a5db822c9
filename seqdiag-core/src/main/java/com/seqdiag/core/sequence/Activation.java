package com.seqdiag.core.sequence;

import java.util.List;
import java.util.Objects;

/**
 * The processing triggered by a message, possibly containing nested activations.
 *
 * @param message the triggering message
 * @param hasBody whether the triggering statement opened a nested block
 * @param nestedActivations activations started while this one is active, in order
 * @param returnMessage the reply ending this activation, or null
 */
public record Activation(
    Message message,
    boolean hasBody,
    List<Activation> nestedActivations,
    Message returnMessage
) {
    /**
     * Compact constructor with validation.
     */
    public Activation {
        Objects.requireNonNull(message, "message must not be null");
        nestedActivations = nestedActivations == null ? List.of() : List.copyOf(nestedActivations);
    }

    /**
     * Creates an activation without a body.
     *
     * @param message the triggering message
     */
    public Activation(Message message) {
        this(message, false, List.of(), null);
    }
}
