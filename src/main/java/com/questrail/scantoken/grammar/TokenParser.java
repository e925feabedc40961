package com.questrail.scantoken.grammar;

import java.util.Objects;

/**
 * TokenParser
 * -----------------------------------------------------------------------------
 * Anchored parser: the <em>entire</em> input must be exactly one token.
 *
 * <p>Reads at most one character past a complete token before rejecting, so
 * arbitrarily long inputs are rejected in constant time once they overrun
 * {@code MAX_TOKEN_LENGTH}.</p>
 *
 * <p>Pure and thread-safe; each call uses its own {@link TokenStateMachine}.</p>
 */
public final class TokenParser
{
    private TokenParser() {}

    public static ParseResult parse(CharSequence input)
    {
        Objects.requireNonNull(input, "input");

        final TokenStateMachine machine = new TokenStateMachine();
        for (int i = 0; i < input.length(); i++) {
            if (machine.advance(input.charAt(i)) == ParserState.REJECT) {
                return new ParseResult.Rejected(machine.rejectedIn(), machine.rejectReason(), i);
            }
        }

        if (machine.endOfInput() == ParserState.REJECT) {
            return new ParseResult.Rejected(machine.rejectedIn(), machine.rejectReason(), input.length());
        }

        return new ParseResult.Accepted(TokenMatch.slice(input, 0, machine.componentLength()));
    }
}
