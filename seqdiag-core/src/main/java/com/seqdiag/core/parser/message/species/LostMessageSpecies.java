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
 * Lost messages: sent by the active entity to no receiver ({@code -> *}).
 */
public class LostMessageSpecies implements MessageSpecies {

    @Override
    public Optional<Activation> match(MessageDescription description, Entity active) {
        if (description.fromOutside() || description.target() != null) {
            return Optional.empty();
        }

        MessageDescription.Evidence evidence = description.evidence();
        if (description.type() != MessageType.SYNC) {
            throw new ParserException("lost messages must be synchronous", evidence.type());
        }
        if (active == null) {
            throw new ParserException("no active entity to send a lost message", evidence.fromOutside());
        }
        if (description.block() != null) {
            throw new ParserException("lost messages cannot open a nested activation", evidence.block());
        }

        return Optional.of(new Activation(
            new Message(MessageStyle.LOST, active, null, description.label())
        ));
    }
}
