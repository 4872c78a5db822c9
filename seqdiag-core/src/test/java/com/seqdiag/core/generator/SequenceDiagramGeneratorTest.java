package com.seqdiag.core.generator;

import com.seqdiag.core.config.DiagramConfig;
import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.sequence.Sequence;
import com.seqdiag.core.tokenizer.TokenizerException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link SequenceDiagramGenerator}.
 */
class SequenceDiagramGeneratorTest {

    private static final String SOURCE = """
        # login flow
        actor User "End User"
        component Server
        component Db "Database"

        -> User: "open app" {
          -> Server: "login" {
            -> Db: "find user" {
              return "user"
            }
            -> *: "audit"
            return "session"
          }
        }
        """;

    private final SequenceDiagramGenerator generator = new SequenceDiagramGenerator(DiagramConfig.defaults());

    @Test
    void parse_returnsEntitiesInDeclarationOrder() {
        Sequence sequence = generator.parse(SOURCE);

        assertThat(sequence.entities()).extracting(Entity::id).containsExactly("User", "Server", "Db");
        assertThat(sequence.activations()).hasSize(1);
    }

    @Test
    void generate_producesSvgWithEntityNames() {
        GeneratedDiagram diagram = generator.generate("login", SOURCE);

        assertThat(diagram.name()).isEqualTo("login");
        assertThat(diagram.fileExtension()).isEqualTo("svg");
        assertThat(diagram.content())
            .startsWith("<svg")
            .contains(">End User</text>", ">Server</text>", ">Database</text>");
    }

    @Test
    void generate_invalidSource_throwsParserException() {
        assertThatThrownBy(() -> generator.generate("broken", "-> Missing"))
            .isInstanceOf(ParserException.class)
            .hasMessageContaining("unknown entity 'Missing'");
    }

    @Test
    void generate_invalidCharacters_throwsTokenizerException() {
        assertThatThrownBy(() -> generator.generate("broken", "actor $"))
            .isInstanceOf(TokenizerException.class);
    }
}
