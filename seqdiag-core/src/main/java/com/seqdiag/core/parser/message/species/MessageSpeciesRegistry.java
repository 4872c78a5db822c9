package com.seqdiag.core.parser.message.species;

import com.seqdiag.core.parser.ParserException;
import com.seqdiag.core.parser.message.MessageDescription;
import com.seqdiag.core.sequence.Activation;
import com.seqdiag.core.sequence.Entity;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered collection of {@link MessageSpecies}, tried first-match-wins.
 *
 * <p>Default order:
 * <ol>
 *   <li>{@link LostMessageSpecies}: not from outside, no target</li>
 *   <li>{@link FoundMessageSpecies}: from outside</li>
 *   <li>{@link CallMessageSpecies}: not from outside, concrete target</li>
 * </ol>
 * Species added later may have a broader shape than earlier ones, so the order must be kept.
 */
public class MessageSpeciesRegistry {

    private final List<MessageSpecies> species;

    public MessageSpeciesRegistry(List<MessageSpecies> species) {
        Objects.requireNonNull(species, "species must not be null");
        this.species = List.copyOf(species);
    }

    /**
     * Creates the registry with the built-in species in their default order.
     *
     * @return default registry
     */
    public static MessageSpeciesRegistry defaults() {
        return new MessageSpeciesRegistry(List.of(
            new LostMessageSpecies(),
            new FoundMessageSpecies(),
            new CallMessageSpecies()
        ));
    }

    /**
     * Classifies a description using the first species that claims it.
     *
     * @param description the parsed statement
     * @param active the enclosing active entity, or null at the top level
     * @return the resulting activation
     * @throws ParserException if a species rejects the description, or if none claims it
     */
    public Activation classify(MessageDescription description, Entity active) {
        for (MessageSpecies candidate : species) {
            Optional<Activation> result = candidate.match(description, active);
            if (result.isPresent()) {
                return result.get();
            }
        }
        throw new ParserException("unrecognized statement", description.evidence().type());
    }

    /**
     * Returns the species in the order they are tried.
     *
     * @return immutable species list
     */
    public List<MessageSpecies> getSpecies() {
        return species;
    }
}
