package com.questrail.scantoken.error;

import java.util.Objects;

/**
 * Base type for all recoverable failures raised by token generation and
 * validation.
 *
 * <p>These exceptions are checked: every failure is a normal, expected outcome
 * that the caller must handle (reject a candidate, retry entropy, report an
 * unknown issuer). Messages never contain a token's entropy segment.</p>
 */
public abstract class ScannableTokenException extends Exception
{
    private final TokenErrorKind kind;

    protected ScannableTokenException(TokenErrorKind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected ScannableTokenException(TokenErrorKind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Returns the failure kind.
     */
    public TokenErrorKind kind()
    {
        return kind;
    }
}
