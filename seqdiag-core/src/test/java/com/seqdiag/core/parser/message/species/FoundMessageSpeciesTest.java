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
 * Tests for {@link FoundMessageSpecies}.
 */
class FoundMessageSpeciesTest {

    private static final Token OUTSIDE = new Token(TokenType.ASTERISK, 0, "*");
    private static final Token ARROW = new Token(TokenType.ARROW_SYNC, 2, "->");
    private static final Token TARGET = new Token(TokenType.IDENTIFIER, 5, "target");
    private static final Token BRACE = new Token(TokenType.BRACE_OPEN, 12, "{");

    private final Entity target = new Entity(EntityType.COMPONENT, "target", "Target");
    private final Entity active = new Entity(EntityType.COMPONENT, "active", "Active");
    private final FoundMessageSpecies species = new FoundMessageSpecies();

    private static MessageDescription description(MessageType type, boolean fromOutside, Entity target,
                                                  NestedBlock block) {
        return new MessageDescription(type, fromOutside, target, "label", block,
            new MessageDescription.Evidence(ARROW, OUTSIDE, TARGET, TARGET, BRACE));
    }

    @Test
    void match_notFromOutside_returnsEmpty() {
        MessageDescription desc = description(MessageType.SYNC, false, target, null);

        assertThat(species.match(desc, null)).isEmpty();
    }

    @Test
    void match_valid_createsFoundActivation() {
        MessageDescription desc = description(MessageType.SYNC, true, target, null);

        Optional<Activation> result = species.match(desc, null);

        assertThat(result).isPresent();
        assertThat(result.get().message()).isEqualTo(new Message(MessageStyle.FOUND, null, target, "label"));
        assertThat(result.get().hasBody()).isFalse();
    }

    @Test
    void match_async_throwsCitingArrow() {
        MessageDescription desc = description(MessageType.ASYNC, true, target, null);

        assertThatThrownBy(() -> species.match(desc, null))
            .isInstanceOf(ParserException.class)
            .hasMessage("found messages must be synchronous")
            .satisfies(e -> assertThat(((ParserException) e).getPrimaryToken()).isEqualTo(ARROW));
    }

    @Test
    void match_withoutTarget_throwsCitingTarget() {
        MessageDescription desc = description(MessageType.SYNC, true, null, null);

        assertThatThrownBy(() -> species.match(desc, null))
            .isInstanceOf(ParserException.class)
            .hasMessage("found messages need a target")
            .satisfies(e -> assertThat(((ParserException) e).getPrimaryToken()).isEqualTo(TARGET));
    }

    @Test
    void match_withActiveEntity_throwsCitingOutsideMarker() {
        MessageDescription desc = description(MessageType.SYNC, true, target, null);

        assertThatThrownBy(() -> species.match(desc, active))
            .isInstanceOf(ParserException.class)
            .hasMessage("found messages can only be received at the top level")
            .satisfies(e -> assertThat(((ParserException) e).getPrimaryToken()).isEqualTo(OUTSIDE));
    }

    @Test
    void match_withBlock_throwsCitingBlock() {
        NestedBlock block = new NestedBlock(null, List.of(), new NestedBlock.Evidence(BRACE));
        MessageDescription desc = description(MessageType.SYNC, true, target, block);

        assertThatThrownBy(() -> species.match(desc, null))
            .isInstanceOf(ParserException.class)
            .hasMessage("found messages cannot open a nested activation")
            .satisfies(e -> assertThat(((ParserException) e).getPrimaryToken()).isEqualTo(BRACE));
    }
}
