package com.seqdiag.core.tokenizer;

import java.util.Objects;

/**
 * A single lexical token.
 *
 * @param type token kind
 * @param position zero-based UTF-16 offset of the first character in the source
 * @param lexeme literal source text of the token
 */
public record Token(
    TokenType type,
    int position,
    String lexeme
) {
    /**
     * Compact constructor with validation.
     */
    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(lexeme, "lexeme must not be null");
        if (position < 0) {
            throw new IllegalArgumentException("position must not be negative: " + position);
        }
    }
}
