package com.questrail.scantoken.error;

import com.questrail.scantoken.grammar.ParserState;
import com.questrail.scantoken.grammar.RejectReason;

import java.util.Objects;

/**
 * Raised when a candidate string does not satisfy the token grammar.
 *
 * <p>Carries the parser state that was active when the input was rejected, the
 * reason, and the zero-based input offset of the offending character (or the
 * input length for a premature end).</p>
 */
public final class MalformedTokenException extends ScannableTokenException
{
    private final ParserState failedState;
    private final RejectReason reason;
    private final int offset;

    public MalformedTokenException(ParserState failedState, RejectReason reason, int offset)
    {
        super(TokenErrorKind.MALFORMED_TOKEN,
                "Malformed token: " + reason.description()
                        + " in " + failedState + " at offset " + offset);
        this.failedState = Objects.requireNonNull(failedState, "failedState");
        this.reason = Objects.requireNonNull(reason, "reason");
        this.offset = offset;
    }

    public ParserState failedState()
    {
        return failedState;
    }

    public RejectReason reason()
    {
        return reason;
    }

    public int offset()
    {
        return offset;
    }
}
