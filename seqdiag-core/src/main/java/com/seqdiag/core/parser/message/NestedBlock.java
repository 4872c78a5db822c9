package com.seqdiag.core.parser.message;

import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.tokenizer.Token;

import java.util.List;
import java.util.Objects;

/**
 * The parsed body of a message statement.
 *
 * @param returnValue declared return value, or null
 * @param activations activations parsed from the block, in order
 * @param evidence source tokens backing the fields
 */
public record NestedBlock(
    String returnValue,
    List<Activation> activations,
    Evidence evidence
) {
    /**
     * Compact constructor with validation.
     */
    public NestedBlock {
        Objects.requireNonNull(evidence, "evidence must not be null");
        activations = activations == null ? List.of() : List.copyOf(activations);
    }

    /**
     * Source tokens for each field of a {@link NestedBlock}.
     *
     * @param returnValue the {@code return} keyword, or the closing brace when no value was returned
     */
    public record Evidence(Token returnValue) {
        public Evidence {
            Objects.requireNonNull(returnValue, "returnValue must not be null");
        }
    }
}
