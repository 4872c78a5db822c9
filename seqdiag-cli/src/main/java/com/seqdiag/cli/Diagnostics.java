package com.seqdiag.cli;

import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.tokenizer.SourceLocation;
import com.seqdiag.core.tokenizer.TokenizerException;

import java.nio.file.Path;

/**
 * Formats tokenizer and parser failures as {@code file:line:column: message}.
 */
final class Diagnostics {

    private Diagnostics() {
        // Utility class
    }

    static String format(Path file, String source, ParserException e) {
        SourceLocation location = SourceLocation.of(source, e.getPrimaryToken().position());
        return file + ":" + location + ": " + e.getMessage();
    }

    static String format(Path file, String source, TokenizerException e) {
        SourceLocation location = SourceLocation.of(source, e.getPosition());
        return file + ":" + location + ": " + e.getMessage();
    }
}
