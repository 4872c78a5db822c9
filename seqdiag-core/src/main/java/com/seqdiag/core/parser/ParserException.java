package com.seqdiag.core.parser;

import com.seqdiag.core.tokenizer.Token;

import java.util.List;
import java.util.Objects;

/**
 * Diagnostic raised when a statement cannot be turned into a valid model object.
 *
 * <p>Always carries the token(s) that caused the failure, so callers can report an exact
 * source location.
 */
public class ParserException extends RuntimeException {

    private final List<Token> tokens;

    public ParserException(String message, Token token) {
        this(message, List.of(Objects.requireNonNull(token, "token must not be null")));
    }

    public ParserException(String message, List<Token> tokens) {
        super(message);
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("a parser diagnostic needs at least one token");
        }
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Returns all tokens cited by this diagnostic.
     *
     * @return evidence tokens, never empty
     */
    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Returns the token a diagnostic location should point at.
     *
     * @return the first cited token
     */
    public Token getPrimaryToken() {
        return tokens.get(0);
    }
}
