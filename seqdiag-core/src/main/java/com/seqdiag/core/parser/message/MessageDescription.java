package com.seqdiag.core.parser.message;

import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.tokenizer.Token;

import java.util.Objects;

/**
 * Generic, not yet validated description of a message statement.
 *
 * <p>Produced by the parser for every message statement and consumed by exactly one
 * {@link com.seqdiag.core.parser.message.species.MessageSpecies}.
 *
 * @param type delivery type
 * @param fromOutside whether the statement started with the outside marker {@code *}
 * @param target receiving entity, or null if the target was the outside marker
 * @param label message label (empty if none was given)
 * @param block the statement's nested block, or null
 * @param evidence source tokens backing the fields
 */
public record MessageDescription(
    MessageType type,
    boolean fromOutside,
    Entity target,
    String label,
    NestedBlock block,
    Evidence evidence
) {
    /**
     * Compact constructor with validation.
     */
    public MessageDescription {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(evidence, "evidence must not be null");
    }

    /**
     * Source tokens for each field of a {@link MessageDescription}.
     *
     * <p>Fields whose value is absent still carry the token that proved the absence.
     *
     * @param type the arrow
     * @param fromOutside the outside marker, or the arrow if there was none
     * @param target the target identifier or outside marker
     * @param label the label string, or the target token if there was none
     * @param block the opening brace, or the last token of the statement if there was no block
     */
    public record Evidence(
        Token type,
        Token fromOutside,
        Token target,
        Token label,
        Token block
    ) {
        public Evidence {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(fromOutside, "fromOutside must not be null");
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(block, "block must not be null");
        }

        /**
         * Creates evidence pointing every field at the same token.
         *
         * @param token the token
         * @return uniform evidence
         */
        public static Evidence of(Token token) {
            return new Evidence(token, token, token, token, token);
        }
    }
}
