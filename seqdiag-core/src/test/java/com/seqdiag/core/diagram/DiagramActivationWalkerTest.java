package com.seqdiag.core.diagram;

import com.seqdiag.core.diagram.parts.ActivationBarDiagramPart;
import com.seqdiag.core.diagram.parts.MessageDiagramPart;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.sequence.EntityType;
import com.seqdiag.core.sequence.Message;
import com.seqdiag.core.sequence.MessageStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DiagramActivationWalker}.
 */
class DiagramActivationWalkerTest {

    private final Entity x = new Entity(EntityType.ACTOR, "x", "X");
    private final Entity y = new Entity(EntityType.COMPONENT, "y", "Y");
    private final Entity z = new Entity(EntityType.COMPONENT, "z", "Z");

    private DiagramParts walk(Activation... roots) {
        DiagramBuilder builder = new DiagramBuilder();
        builder.addEntity(x);
        builder.addEntity(y);
        builder.addEntity(z);
        DiagramActivationWalker walker = new DiagramActivationWalker(builder);
        for (Activation root : roots) {
            walker.walk(root);
        }
        return builder.build();
    }

    @Test
    void walk_callWithNestedLostMessage_emitsCallThenLost() {
        Message call = new Message(MessageStyle.CALL, x, y, "call");
        Message lost = new Message(MessageStyle.LOST, y, null, "lost");
        Activation root = new Activation(call, true, List.of(new Activation(lost)), null);

        DiagramParts parts = walk(root);

        assertThat(parts.entities()).extracting(p -> p.getEntity().id()).containsExactly("x", "y", "z");
        assertThat(parts.activationBars()).containsExactly(new ActivationBarDiagramPart(root, 0));
        assertThat(parts.messages()).extracting(MessageDiagramPart::message).containsExactly(call, lost);
    }

    @Test
    void walk_isDepthFirstPreOrder() {
        Message a = new Message(MessageStyle.CALL, null, x, "a");
        Message b = new Message(MessageStyle.CALL, x, y, "b");
        Message c = new Message(MessageStyle.CALL, y, z, "c");
        Message d = new Message(MessageStyle.ASYNC_CALL, x, z, "d");
        Message bReturn = new Message(MessageStyle.RETURN, y, x, "b-result");

        Activation cActivation = new Activation(c, true, List.of(), null);
        Activation bActivation = new Activation(b, true, List.of(cActivation), bReturn);
        Activation dActivation = new Activation(d);
        Activation root = new Activation(a, true, List.of(bActivation, dActivation), null);

        DiagramParts parts = walk(root);

        assertThat(parts.messages()).extracting(MessageDiagramPart::message)
            .containsExactly(a, b, c, bReturn, d);
        assertThat(parts.activationBars()).containsExactly(
            new ActivationBarDiagramPart(root, 0),
            new ActivationBarDiagramPart(bActivation, 1),
            new ActivationBarDiagramPart(cActivation, 2)
        );
    }

    @Test
    void walk_activationWithoutBody_hasNoBar() {
        Activation leaf = new Activation(new Message(MessageStyle.CALL, x, y, "leaf"));

        DiagramParts parts = walk(leaf);

        assertThat(parts.activationBars()).isEmpty();
        assertThat(parts.messages()).hasSize(1);
    }

    @Test
    void walk_multipleRoots_keepRootOrder() {
        Message first = new Message(MessageStyle.FOUND, null, x, "first");
        Message second = new Message(MessageStyle.CALL, null, y, "second");

        DiagramParts parts = walk(new Activation(first), new Activation(second));

        assertThat(parts.messages()).extracting(MessageDiagramPart::message).containsExactly(first, second);
    }
}
