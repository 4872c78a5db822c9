package com.seqdiag.core.sequence;

/**
 * Visual and semantic kinds of messages.
 */
public enum MessageStyle {
    /** Synchronous call, possibly opening an activation */
    CALL,

    /** Fire-and-forget call */
    ASYNC_CALL,

    /** Reply to a synchronous call */
    RETURN,

    /** Message sent into the void, without a receiver */
    LOST,

    /** Message arriving from outside the diagram, without a sender */
    FOUND
}
