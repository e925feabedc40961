package com.questrail.scantoken.grammar;

/**
 * States of the token grammar state machine.
 *
 * <pre>
 *   START → PREFIX → COMPONENT → SEPARATOR → ENTROPY → CHECKSUM → ACCEPT
 *     └────────┴──────────┴───────────┴──────────┴──────────┴────────┴──→ REJECT
 * </pre>
 *
 * <p>Each non-terminal state names the segment currently being read.
 * {@link #REJECT} is absorbing. {@link #ACCEPT} is final for anchored
 * parsing: any further character moves the machine to {@link #REJECT}.</p>
 */
public enum ParserState
{
    /** Nothing consumed yet. */
    START,

    /** Reading the literal {@code asf_}. */
    PREFIX,

    /** Reading the 3-6 letter component. */
    COMPONENT,

    /** The {@code _} after the component has just been consumed. */
    SEPARATOR,

    /** Reading the 27 entropy characters. */
    ENTROPY,

    /** Reading the 6 checksum characters. */
    CHECKSUM,

    /** A complete token has been consumed. */
    ACCEPT,

    /** Input did not satisfy the grammar. */
    REJECT;

    public boolean isTerminal()
    {
        return this == ACCEPT || this == REJECT;
    }
}
