package com.seqdiag.core.diagram.parts;

import com.seqdiag.core.sequence.Message;

import java.util.Objects;

/**
 * A message arrow between two entity parts.
 *
 * <p>Endpoints are null where the message has no sender or receiver. Message arrows are not
 * drawn yet: their vertical position depends on a vertical layout that does not exist.
 *
 * @param message the message
 * @param from part of the sending entity, or null
 * @param to part of the receiving entity, or null
 */
public record MessageDiagramPart(
    Message message,
    EntityDiagramPart from,
    EntityDiagramPart to
) {
    /**
     * Compact constructor with validation.
     */
    public MessageDiagramPart {
        Objects.requireNonNull(message, "message must not be null");
    }
}
