package com.seqdiag.core.parser.message.species;

import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.parser.message.MessageDescription;
import com.seqdiag.core.parser.message.MessageType;
import com.seqdiag.core.parser.message.NestedBlock;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.sequence.EntityType;
import com.seqdiag.core.sequence.Message;
import com.seqdiag.core.sequence.MessageStyle;
import com.seqdiag.core.tokenizer.Token;
import com.seqdiag.core.tokenizer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LostMessageSpecies}.
 */
class LostMessageSpeciesTest {

    private static final Token ARROW = new Token(TokenType.ARROW_SYNC, 0, "->");
    private static final Token TARGET = new Token(TokenType.ASTERISK, 3, "*");
    private static final Token BRACE = new Token(TokenType.BRACE_OPEN, 5, "{");

    private final Entity target = new Entity(EntityType.COMPONENT, "target", "Target");
    private final Entity active = new Entity(EntityType.COMPONENT, "active", "Active");
    private final LostMessageSpecies species = new LostMessageSpecies();

    private static MessageDescription description(MessageType type, boolean fromOutside, Entity target,
                                                  NestedBlock block) {
        return new MessageDescription(type, fromOutside, target, "label", block,
            new MessageDescription.Evidence(ARROW, ARROW, TARGET, TARGET, BRACE));
    }

    @Test
    void match_fromOutside_returnsEmpty() {
        MessageDescription desc = description(MessageType.SYNC, true, null, null);

        assertThat(species.match(desc, active)).isEmpty();
    }

    @Test
    void match_withTarget_returnsEmpty() {
        MessageDescription desc = description(MessageType.SYNC, false, target, null);

        assertThat(species.match(desc, active)).isEmpty();
    }

    @Test
    void match_valid_createsLostActivation() {
        MessageDescription desc = description(MessageType.SYNC, false, null, null);

        Optional<Activation> result = species.match(desc, active);

        assertThat(result).isPresent();
        Activation activation = result.get();
        assertThat(activation.message()).isEqualTo(new Message(MessageStyle.LOST, active, null, "label"));
        assertThat(activation.hasBody()).isFalse();
        assertThat(activation.nestedActivations()).isEmpty();
        assertThat(activation.returnMessage()).isNull();
    }

    @Test
    void match_async_throwsCitingArrow() {
        MessageDescription desc = description(MessageType.ASYNC, false, null, null);

        assertThatThrownBy(() -> species.match(desc, active))
            .isInstanceOf(ParserException.class)
            .hasMessage("lost messages must be synchronous")
            .satisfies(e -> assertThat(((ParserException) e).getPrimaryToken()).isEqualTo(ARROW));
    }

    @Test
    void match_withoutActiveEntity_throws() {
        MessageDescription desc = description(MessageType.SYNC, false, null, null);

        assertThatThrownBy(() -> species.match(desc, null))
            .isInstanceOf(ParserException.class)
            .hasMessage("no active entity to send a lost message");
    }

    @Test
    void match_withBlock_throwsCitingBlock() {
        NestedBlock block = new NestedBlock(null, List.of(), new NestedBlock.Evidence(BRACE));
        MessageDescription desc = description(MessageType.SYNC, false, null, block);

        assertThatThrownBy(() -> species.match(desc, active))
            .isInstanceOf(ParserException.class)
            .hasMessage("lost messages cannot open a nested activation")
            .satisfies(e -> assertThat(((ParserException) e).getPrimaryToken()).isEqualTo(BRACE));
    }
}
