package com.seqdiag.core.sequence;

import java.util.Objects;

/**
 * A message between two entities.
 *
 * <p>Either endpoint may be {@code null}: a {@code null} sender means the message enters the
 * diagram from outside, a {@code null} receiver means it leaves the diagram.
 *
 * @param style message style
 * @param from sending entity, or null
 * @param to receiving entity, or null
 * @param label message label (may be empty)
 */
public record Message(
    MessageStyle style,
    Entity from,
    Entity to,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public Message {
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
