package com.seqdiag.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int OK = 0;

    /** The input is not a valid sequence */
    public static final int INVALID_INPUT = 1;

    /** A file could not be read or written */
    public static final int IO_ERROR = 2;

    private ExitCodes() {
        // Constants class
    }
}
