package com.seqdiag.core.tokenizer;

/**
 * Kinds of tokens produced by the {@link Tokenizer}.
 */
public enum TokenType {
    /** Keyword {@code actor} */
    ACTOR,

    /** Keyword {@code component} */
    COMPONENT,

    /** Keyword {@code return} */
    RETURN,

    /** Synchronous arrow {@code ->} */
    ARROW_SYNC,

    /** Asynchronous arrow {@code ~>} */
    ARROW_ASYNC,

    /** {@code *}, marking the outside of the diagram */
    ASTERISK,

    COLON,

    BRACE_OPEN,

    BRACE_CLOSE,

    /** Double-quoted string literal */
    STRING,

    IDENTIFIER,

    /** Synthetic token terminating every token list */
    END
}
