package com.questrail.scantoken.grammar;

import com.questrail.scantoken.api.TokenFormat;

/**
 * TokenStateMachine
 * -----------------------------------------------------------------------------
 * Character-at-a-time recognizer for the token grammar.
 *
 * <pre>
 *   asf_ [a-z]{3,6} _ [0-9A-Za-z]{27} [0-4] [0-9A-Za-z]{5}
 * </pre>
 *
 * <p>The machine is single-use and not thread-safe: create one per parse
 * attempt. It never looks ahead and never backtracks. Because the component
 * is terminated by a character outside its class and the remaining segments
 * are fixed-width, a given start position has at most one possible match.</p>
 *
 * <p>On rejection the machine records the state it was in and the reason, so
 * callers can report precisely why a candidate failed.</p>
 */
public final class TokenStateMachine
{
    private ParserState state = ParserState.START;

    /* characters consumed within the current segment */
    private int segmentLength;

    private int componentLength;
    private int consumed;

    private ParserState rejectedIn;
    private RejectReason rejectReason;

    /**
     * Feeds one character and returns the resulting state.
     */
    public ParserState advance(char c)
    {
        switch (state) {
            case START -> {
                if (c == TokenFormat.PREFIX_WITH_SEPARATOR.charAt(0)) {
                    enter(ParserState.PREFIX);
                    segmentLength = 1;
                } else {
                    reject(RejectReason.PREFIX_MISMATCH);
                }
            }
            case PREFIX -> {
                if (c != TokenFormat.PREFIX_WITH_SEPARATOR.charAt(segmentLength)) {
                    reject(RejectReason.PREFIX_MISMATCH);
                } else if (++segmentLength == TokenFormat.PREFIX_WITH_SEPARATOR.length()) {
                    enter(ParserState.COMPONENT);
                }
            }
            case COMPONENT -> {
                if (TokenFormat.isComponentChar(c)) {
                    if (segmentLength == TokenFormat.MAX_COMPONENT_LENGTH) {
                        reject(RejectReason.COMPONENT_TOO_LONG);
                    } else {
                        segmentLength++;
                    }
                } else if (c == TokenFormat.SEPARATOR) {
                    if (segmentLength < TokenFormat.MIN_COMPONENT_LENGTH) {
                        reject(RejectReason.COMPONENT_TOO_SHORT);
                    } else {
                        componentLength = segmentLength;
                        enter(ParserState.SEPARATOR);
                    }
                } else {
                    reject(RejectReason.INVALID_COMPONENT_CHARACTER);
                }
            }
            case SEPARATOR -> {
                if (TokenFormat.isBase62Char(c)) {
                    enter(ParserState.ENTROPY);
                    segmentLength = 1;
                } else {
                    reject(RejectReason.INVALID_ENTROPY_CHARACTER);
                }
            }
            case ENTROPY -> {
                if (!TokenFormat.isBase62Char(c)) {
                    reject(RejectReason.INVALID_ENTROPY_CHARACTER);
                } else if (++segmentLength == TokenFormat.ENTROPY_LENGTH) {
                    enter(ParserState.CHECKSUM);
                }
            }
            case CHECKSUM -> {
                if (segmentLength == 0 && !TokenFormat.isChecksumLeadChar(c)) {
                    reject(TokenFormat.isBase62Char(c)
                            ? RejectReason.CHECKSUM_LEADING_DIGIT_OUT_OF_RANGE
                            : RejectReason.INVALID_CHECKSUM_CHARACTER);
                } else if (!TokenFormat.isBase62Char(c)) {
                    reject(RejectReason.INVALID_CHECKSUM_CHARACTER);
                } else if (++segmentLength == TokenFormat.CHECKSUM_LENGTH) {
                    enter(ParserState.ACCEPT);
                }
            }
            case ACCEPT -> reject(RejectReason.TRAILING_INPUT);
            case REJECT -> {
                return state;
            }
        }

        if (state != ParserState.REJECT) {
            consumed++;
        }
        return state;
    }

    /**
     * Signals end of input. Any state other than {@link ParserState#ACCEPT}
     * becomes {@link ParserState#REJECT} with {@link RejectReason#PREMATURE_END}.
     */
    public ParserState endOfInput()
    {
        if (!state.isTerminal()) {
            reject(RejectReason.PREMATURE_END);
        }
        return state;
    }

    public ParserState state()
    {
        return state;
    }

    /**
     * Number of characters accepted so far.
     */
    public int consumed()
    {
        return consumed;
    }

    /**
     * Length of the component segment; valid once the machine has passed
     * {@link ParserState#SEPARATOR}.
     */
    public int componentLength()
    {
        return componentLength;
    }

    /**
     * State in which the machine was rejected, or {@code null} if it has not been.
     */
    public ParserState rejectedIn()
    {
        return rejectedIn;
    }

    /**
     * Reason for rejection, or {@code null} if the machine has not been rejected.
     */
    public RejectReason rejectReason()
    {
        return rejectReason;
    }

    private void enter(ParserState next)
    {
        state = next;
        segmentLength = 0;
    }

    private void reject(RejectReason reason)
    {
        rejectedIn = state;
        rejectReason = reason;
        state = ParserState.REJECT;
    }
}
