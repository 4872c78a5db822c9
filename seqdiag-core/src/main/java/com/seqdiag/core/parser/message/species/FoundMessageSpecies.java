package com.seqdiag.core.parser.message.species;

import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.parser.message.MessageDescription;
import com.seqdiag.core.parser.message.MessageType;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;
import com.seqdiag.core.sequence.Message;
import com.seqdiag.core.sequence.MessageStyle;

import java.util.Optional;

/**
 * Found messages: arriving from outside the diagram at a target entity ({@code * -> Target}).
 *
 * <p>Found messages have no sender, so they are only valid at the top level.
 */
public class FoundMessageSpecies implements MessageSpecies {

    @Override
    public Optional<Activation> match(MessageDescription description, Entity active) {
        if (!description.fromOutside()) {
            return Optional.empty();
        }

        MessageDescription.Evidence evidence = description.evidence();
        if (description.type() != MessageType.SYNC) {
            throw new ParserException("found messages must be synchronous", evidence.type());
        }
        if (description.target() == null) {
            throw new ParserException("found messages need a target", evidence.target());
        }
        if (active != null) {
            throw new ParserException("found messages can only be received at the top level", evidence.fromOutside());
        }
        if (description.block() != null) {
            throw new ParserException("found messages cannot open a nested activation", evidence.block());
        }

        return Optional.of(new Activation(
            new Message(MessageStyle.FOUND, null, description.target(), description.label())
        ));
    }
}
