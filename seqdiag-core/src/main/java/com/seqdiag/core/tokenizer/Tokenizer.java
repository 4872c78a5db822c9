package com.seqdiag.core.tokenizer;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns sequence source text into a list of {@link Token}s.
 *
 * <p>Scanning is delegated to the ANTLR-generated {@code SequenceLexer}. Its token types are
 * mapped onto {@link TokenType}, and a synthetic {@link TokenType#END} token positioned at the
 * end of the source is appended so that consumers always have one token of lookahead.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Token> tokens = new Tokenizer().tokenize("actor User\n-> User: \"hello\"");
 * }</pre>
 */
public class Tokenizer {

    private static final Logger log = LoggerFactory.getLogger(Tokenizer.class);

    private static final Map<Integer, TokenType> TYPE_MAPPING = Map.ofEntries(
        Map.entry(SequenceLexer.ACTOR, TokenType.ACTOR),
        Map.entry(SequenceLexer.COMPONENT, TokenType.COMPONENT),
        Map.entry(SequenceLexer.RETURN, TokenType.RETURN),
        Map.entry(SequenceLexer.ARROW_SYNC, TokenType.ARROW_SYNC),
        Map.entry(SequenceLexer.ARROW_ASYNC, TokenType.ARROW_ASYNC),
        Map.entry(SequenceLexer.ASTERISK, TokenType.ASTERISK),
        Map.entry(SequenceLexer.COLON, TokenType.COLON),
        Map.entry(SequenceLexer.BRACE_OPEN, TokenType.BRACE_OPEN),
        Map.entry(SequenceLexer.BRACE_CLOSE, TokenType.BRACE_CLOSE),
        Map.entry(SequenceLexer.STRING, TokenType.STRING),
        Map.entry(SequenceLexer.IDENTIFIER, TokenType.IDENTIFIER)
    );

    /**
     * Tokenizes the given source.
     *
     * @param source sequence source text
     * @return tokens in source order, always terminated by an {@link TokenType#END} token
     * @throws TokenizerException if the source contains an unrecognized character
     */
    public List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source must not be null");

        SequenceLexer lexer = new SequenceLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new FailFastErrorListener(source));

        List<Token> tokens = new ArrayList<>();
        for (org.antlr.v4.runtime.Token t = lexer.nextToken();
             t.getType() != org.antlr.v4.runtime.Token.EOF;
             t = lexer.nextToken()) {
            TokenType type = TYPE_MAPPING.get(t.getType());
            if (type == null) {
                throw new TokenizerException("Unexpected token '" + t.getText() + "'",
                    toCharOffset(source, t.getStartIndex()));
            }
            tokens.add(new Token(type, toCharOffset(source, t.getStartIndex()), t.getText()));
        }
        tokens.add(new Token(TokenType.END, source.length(), ""));

        log.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return List.copyOf(tokens);
    }

    /**
     * Converts an ANTLR code point index into a UTF-16 offset into {@code source}.
     */
    static int toCharOffset(String source, int codePointIndex) {
        return source.offsetByCodePoints(0, codePointIndex);
    }

    /**
     * Error listener that aborts on the first lexer error instead of recovering.
     */
    private static class FailFastErrorListener extends BaseErrorListener {

        private final String source;

        FailFastErrorListener(String source) {
            this.source = source;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            int position = recognizer instanceof Lexer lexer ? toCharOffset(source, lexer._tokenStartCharIndex) : 0;
            throw new TokenizerException("Unrecognized input at " + SourceLocation.of(source, position)
                + " (" + msg + ")", position);
        }
    }
}
