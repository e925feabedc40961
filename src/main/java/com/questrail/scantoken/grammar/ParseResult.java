package com.questrail.scantoken.grammar;

import java.util.Objects;

/**
 * Outcome of an anchored parse.
 *
 * <p>Either the whole input was a structurally valid token ({@link Accepted})
 * or it was rejected, in which case the state, reason and offset of the
 * failure are retained ({@link Rejected}).</p>
 */
public sealed interface ParseResult
        permits ParseResult.Accepted, ParseResult.Rejected
{
    boolean isAccepted();

    record Accepted(TokenMatch match) implements ParseResult
    {
        public Accepted {
            Objects.requireNonNull(match, "match");
        }

        @Override
        public boolean isAccepted()
        {
            return true;
        }
    }

    record Rejected(ParserState failedState, RejectReason reason, int offset) implements ParseResult
    {
        public Rejected {
            Objects.requireNonNull(failedState, "failedState");
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isAccepted()
        {
            return false;
        }
    }
}
