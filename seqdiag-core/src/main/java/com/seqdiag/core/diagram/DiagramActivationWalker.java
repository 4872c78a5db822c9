package com.seqdiag.core.diagram;

import com.seqdiag.core.sequence.Activation;

import java.util.Objects;

/**
 * Flattens activation trees into a {@link DiagramBuilder}.
 *
 * <p>Traversal is depth-first pre-order. For each activation the walker adds its message,
 * then an activation bar if the activation has a body, then walks the nested activations in
 * order, and finally adds the return message, if any.
 */
public class DiagramActivationWalker {

    private final DiagramBuilder builder;

    public DiagramActivationWalker(DiagramBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
    }

    /**
     * Walks a root activation.
     *
     * @param activation the root activation
     */
    public void walk(Activation activation) {
        walk(activation, 0);
    }

    private void walk(Activation activation, int depth) {
        builder.addMessage(activation.message());

        int nestedDepth = depth;
        if (activation.hasBody()) {
            builder.addActivationBar(activation, depth);
            nestedDepth = depth + 1;
        }

        for (Activation nested : activation.nestedActivations()) {
            walk(nested, nestedDepth);
        }

        if (activation.returnMessage() != null) {
            builder.addMessage(activation.returnMessage());
        }
    }
}
