package com.seqdiag.core.parser;

import com.seqdiag.core.tokenizer.Token;
import com.seqdiag.core.tokenizer.TokenType;

import java.util.List;
import java.util.Objects;

/**
 * Left-to-right cursor over a token list with one token of lookahead.
 *
 * <p>The list must be terminated by an {@link TokenType#END} token; the cursor never moves
 * past it.
 */
class TokenCursor {

    private final List<Token> tokens;
    private int index;
    private Token previous;

    TokenCursor(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END) {
            throw new IllegalArgumentException("token list must be terminated by an END token");
        }
        this.tokens = tokens;
    }

    Token peek() {
        return tokens.get(index);
    }

    boolean check(TokenType type) {
        return peek().type() == type;
    }

    Token next() {
        Token token = peek();
        if (token.type() != TokenType.END) {
            index++;
        }
        previous = token;
        return token;
    }

    /**
     * Consumes the next token if it has the given type.
     *
     * @return the consumed token, or null if the next token has a different type
     */
    Token match(TokenType type) {
        return check(type) ? next() : null;
    }

    Token expect(TokenType type, String description) {
        if (!check(type)) {
            Token found = peek();
            String what = found.type() == TokenType.END ? "end of input" : "'" + found.lexeme() + "'";
            throw new ParserException("expected " + description + " but found " + what, found);
        }
        return next();
    }

    /**
     * Returns the most recently consumed token.
     */
    Token previous() {
        return previous;
    }
}
