package com.seqdiag.core.parser.message;

/**
 * Message delivery type, as written in the source arrow.
 */
public enum MessageType {
    /** {@code ->} */
    SYNC,

    /** {@code ~>} */
    ASYNC
}
