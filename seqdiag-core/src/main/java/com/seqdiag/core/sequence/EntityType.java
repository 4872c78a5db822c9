package com.seqdiag.core.sequence;

/**
 * Types of sequence participants.
 */
public enum EntityType {
    /** Human or external actor, drawn as a stick figure */
    ACTOR,

    /** System component, drawn as a box */
    COMPONENT
}
