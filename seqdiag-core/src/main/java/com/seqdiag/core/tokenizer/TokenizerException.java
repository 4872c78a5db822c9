package com.seqdiag.core.tokenizer;

/**
 * Thrown when the source contains characters that do not form any token.
 */
public class TokenizerException extends RuntimeException {

    private final int position;

    public TokenizerException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Returns the source offset at which tokenization failed.
     *
     * @return zero-based character offset
     */
    public int getPosition() {
        return position;
    }
}
