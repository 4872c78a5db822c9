package com.seqdiag.core.parser;

import com.seqdiag.core.parser.message.MessageDescription;
import com.seqdiag.core.parser.message.MessageType;
import com.seqdiag.core.parser.message.NestedBlock;
import com.seqdiag.core.parser.message.species.MessageSpeciesRegistry;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.sequence.EntityType;
import com.seqdiag.core.sequence.Sequence;
import com.seqdiag.core.tokenizer.Token;
import com.seqdiag.core.tokenizer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses a token list into a validated {@link Sequence}.
 *
 * <p><b>Grammar:</b>
 * <pre>
 * sequence    := statement* END
 * statement   := declaration | message
 * declaration := ('actor' | 'component') IDENTIFIER STRING?
 * message     := '*'? ('->' | '~>') (IDENTIFIER | '*') (':' STRING)? block?
 * block       := '{' message* ('return' STRING?)? '}'
 * </pre>
 *
 * <p>Each message statement is read into a {@link MessageDescription} that records, for every
 * field, the token it was derived from. The description is then classified by the
 * {@link MessageSpeciesRegistry}. Blocks are parsed recursively with the statement's target
 * as the active entity, so messages inside a block are sent by the entity that received the
 * enclosing call.
 *
 * <p>Parsing stops at the first diagnostic; no partial sequence is returned.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Token> tokens = new Tokenizer().tokenize(source);
 * Sequence sequence = new SequenceParser().parse(tokens);
 * }</pre>
 */
public class SequenceParser {

    private static final Logger log = LoggerFactory.getLogger(SequenceParser.class);

    private final MessageSpeciesRegistry species;

    public SequenceParser() {
        this(MessageSpeciesRegistry.defaults());
    }

    public SequenceParser(MessageSpeciesRegistry species) {
        this.species = Objects.requireNonNull(species, "species must not be null");
    }

    /**
     * Parses the given tokens.
     *
     * @param tokens tokens terminated by an {@link TokenType#END} token
     * @return the parsed sequence
     * @throws ParserException if the tokens do not form a valid sequence
     */
    public Sequence parse(List<Token> tokens) {
        ParseRun run = new ParseRun(new TokenCursor(tokens));
        Sequence sequence = run.parseSequence();
        log.debug("Parsed sequence with {} entities and {} root activations",
            sequence.entities().size(), sequence.activations().size());
        return sequence;
    }

    /**
     * State of a single pass over one token list.
     */
    private final class ParseRun {

        private final TokenCursor cursor;
        private final Map<String, Entity> entities = new LinkedHashMap<>();

        ParseRun(TokenCursor cursor) {
            this.cursor = cursor;
        }

        Sequence parseSequence() {
            List<Activation> activations = new ArrayList<>();
            while (!cursor.check(TokenType.END)) {
                Token token = cursor.peek();
                switch (token.type()) {
                    case ACTOR, COMPONENT -> parseDeclaration();
                    case RETURN -> throw new ParserException("return is only allowed at the end of a block", token);
                    case BRACE_CLOSE -> throw new ParserException("unexpected '}' without an open block", token);
                    default -> activations.add(parseMessage(null));
                }
            }
            return new Sequence(new ArrayList<>(entities.values()), activations);
        }

        private void parseDeclaration() {
            Token keyword = cursor.next();
            EntityType type = keyword.type() == TokenType.ACTOR ? EntityType.ACTOR : EntityType.COMPONENT;
            Token idToken = cursor.expect(TokenType.IDENTIFIER, "an entity name");
            Token nameToken = cursor.match(TokenType.STRING);

            String id = idToken.lexeme();
            if (entities.containsKey(id)) {
                throw new ParserException("duplicate entity '" + id + "'", idToken);
            }
            String name = nameToken != null ? unquote(nameToken.lexeme()) : id;
            entities.put(id, new Entity(type, id, name));
            log.debug("Declared {} '{}'", type, id);
        }

        private Activation parseMessage(Entity active) {
            Token outsideMarker = cursor.match(TokenType.ASTERISK);
            Token arrow = parseArrow(outsideMarker != null);
            MessageType type = arrow.type() == TokenType.ARROW_ASYNC ? MessageType.ASYNC : MessageType.SYNC;

            Entity target = null;
            Token targetToken = cursor.match(TokenType.ASTERISK);
            if (targetToken == null) {
                targetToken = cursor.expect(TokenType.IDENTIFIER, "a target entity or '*'");
                target = entities.get(targetToken.lexeme());
                if (target == null) {
                    throw new ParserException("unknown entity '" + targetToken.lexeme() + "'", targetToken);
                }
            }

            String label = "";
            Token labelToken = targetToken;
            if (cursor.match(TokenType.COLON) != null) {
                labelToken = cursor.expect(TokenType.STRING, "a label string");
                label = unquote(labelToken.lexeme());
            }

            NestedBlock block = null;
            Token blockToken = cursor.previous();
            if (cursor.check(TokenType.BRACE_OPEN)) {
                blockToken = cursor.next();
                block = parseBlock(blockToken, target);
            }

            MessageDescription description = new MessageDescription(
                type,
                outsideMarker != null,
                target,
                label,
                block,
                new MessageDescription.Evidence(
                    arrow,
                    outsideMarker != null ? outsideMarker : arrow,
                    targetToken,
                    labelToken,
                    blockToken
                )
            );
            return species.classify(description, active);
        }

        private Token parseArrow(boolean afterOutsideMarker) {
            if (cursor.check(TokenType.ARROW_SYNC) || cursor.check(TokenType.ARROW_ASYNC)) {
                return cursor.next();
            }
            Token found = cursor.peek();
            if (afterOutsideMarker) {
                return cursor.expect(TokenType.ARROW_SYNC, "an arrow after '*'");
            }
            throw new ParserException("unexpected '" + found.lexeme()
                + "', expected a declaration or a message starting with '*', '->' or '~>'", found);
        }

        private NestedBlock parseBlock(Token openBrace, Entity active) {
            List<Activation> activations = new ArrayList<>();
            while (true) {
                Token token = cursor.peek();
                switch (token.type()) {
                    case END -> throw new ParserException("unterminated block", List.of(openBrace, token));
                    case BRACE_CLOSE -> {
                        cursor.next();
                        return new NestedBlock(null, activations, new NestedBlock.Evidence(token));
                    }
                    case RETURN -> {
                        Token returnToken = cursor.next();
                        Token valueToken = cursor.match(TokenType.STRING);
                        String value = valueToken != null ? unquote(valueToken.lexeme()) : "";
                        if (!cursor.check(TokenType.BRACE_CLOSE)) {
                            throw new ParserException("return must be the last statement of a block", cursor.peek());
                        }
                        cursor.next();
                        return new NestedBlock(value, activations, new NestedBlock.Evidence(returnToken));
                    }
                    case ACTOR, COMPONENT -> throw new ParserException(
                        "entities must be declared at the top level", token);
                    default -> activations.add(parseMessage(active));
                }
            }
        }
    }

    /**
     * Strips the quotes from a string literal and resolves backslash escapes.
     *
     * @param literal string token lexeme, including quotes
     * @return the string value
     */
    static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char escaped = body.charAt(++i);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
