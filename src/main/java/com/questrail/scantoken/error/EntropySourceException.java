package com.questrail.scantoken.error;

/**
 * Raised when the secure random source could not supply bytes.
 *
 * <p>Generation fails outright. No weaker source is substituted.</p>
 */
public final class EntropySourceException extends ScannableTokenException
{
    public EntropySourceException(String message)
    {
        super(TokenErrorKind.ENTROPY_SOURCE_FAILURE, message);
    }

    public EntropySourceException(String message, Throwable cause)
    {
        super(TokenErrorKind.ENTROPY_SOURCE_FAILURE, message, cause);
    }
}
