package com.seqdiag.core.parser.message.species;

import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.parser.message.MessageDescription;
import com.seqdiag.core.parser.message.MessageType;
import com.seqdiag.core.parser.message.NestedBlock;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.sequence.Message;
import com.seqdiag.core.sequence.MessageStyle;

import java.util.List;
import java.util.Optional;

/**
 * Calls from the active entity (or from the diagram edge at the top level) to a concrete target.
 *
 * <p>Synchronous calls may carry a block, whose activations become the nested activations and
 * whose return value becomes a {@link MessageStyle#RETURN} message back to the caller.
 * Asynchronous calls never wait for the receiver and therefore cannot have a block.
 */
public class CallMessageSpecies implements MessageSpecies {

    @Override
    public Optional<Activation> match(MessageDescription description, Entity active) {
        if (description.fromOutside() || description.target() == null) {
            return Optional.empty();
        }

        NestedBlock block = description.block();
        if (description.type() == MessageType.ASYNC) {
            if (block != null) {
                throw new ParserException("asynchronous messages cannot open a nested activation",
                    List.of(description.evidence().block(), description.evidence().type()));
            }
            return Optional.of(new Activation(
                new Message(MessageStyle.ASYNC_CALL, active, description.target(), description.label())
            ));
        }

        Message call = new Message(MessageStyle.CALL, active, description.target(), description.label());
        if (block == null) {
            return Optional.of(new Activation(call));
        }

        Message returnMessage = block.returnValue() == null
            ? null
            : new Message(MessageStyle.RETURN, description.target(), active, block.returnValue());
        return Optional.of(new Activation(call, true, block.activations(), returnMessage));
    }
}
