package com.seqdiag.core.diagram.parts;

import com.seqdiag.core.sequence.Activation;

import java.util.Objects;

/**
 * The bar on the receiver's lifeline covering an activation with a body and its descendants.
 *
 * <p>The vertical span is not computed yet; {@code depth} records how many bars enclose this
 * one, which is all a future vertical layout needs to stack them.
 *
 * @param activation the covered activation
 * @param depth number of enclosing activation bars
 */
public record ActivationBarDiagramPart(
    Activation activation,
    int depth
) {
    /**
     * Compact constructor with validation.
     */
    public ActivationBarDiagramPart {
        Objects.requireNonNull(activation, "activation must not be null");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
    }
}
