package com.seqdiag.core.parser.message.species;

import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.parser.message.MessageDescription;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;

import java.util.Optional;

/**
 * Classifies a generic {@link MessageDescription} as one specific kind of message.
 *
 * <p>A species has three possible outcomes:
 * <ul>
 *   <li>an empty result: the description does not have this species' shape</li>
 *   <li>an {@link Activation}: the description is valid for this species</li>
 *   <li>a thrown {@link ParserException}: the description has this species' shape but violates
 *       one of its constraints; no further species are tried</li>
 * </ul>
 *
 * <p>Implementations must be pure and must return empty for any description they do not own.
 *
 * @see MessageSpeciesRegistry
 */
@FunctionalInterface
public interface MessageSpecies {

    /**
     * Attempts to claim the given description.
     *
     * @param description the parsed statement
     * @param active the entity whose activation encloses the statement, or null at the top level
     * @return the activation built from the description, or empty if this species does not apply
     * @throws ParserException if the description belongs to this species but is invalid
     */
    Optional<Activation> match(MessageDescription description, Entity active);
}
