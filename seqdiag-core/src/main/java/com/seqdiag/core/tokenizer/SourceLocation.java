package com.seqdiag.core.tokenizer;

import java.util.Objects;

/**
 * Human-readable location within a source text.
 *
 * @param line 1-based line number
 * @param column 1-based column number
 */
public record SourceLocation(int line, int column) {

    /**
     * Resolves a character offset into a line and column.
     *
     * <p>Offsets past the end of the source resolve to the position just after the last character.
     *
     * @param source the full source text
     * @param offset zero-based character offset
     * @return the location of the offset
     */
    public static SourceLocation of(String source, int offset) {
        Objects.requireNonNull(source, "source must not be null");
        int end = Math.min(Math.max(offset, 0), source.length());

        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(line, end - lineStart + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
