package com.questrail.scantoken.error;

/**
 * Raised when a structurally valid token's checksum does not equal the
 * checksum recomputed from its entropy segment.
 *
 * <p>Both checksum values are exposed; they are derived from, but do not
 * reveal, the entropy.</p>
 */
public final class ChecksumMismatchException extends ScannableTokenException
{
    private final String expected;
    private final String actual;

    public ChecksumMismatchException(String expected, String actual)
    {
        super(TokenErrorKind.CHECKSUM_MISMATCH,
                "Checksum mismatch: transmitted=" + actual + " computed=" + expected);
        this.expected = expected;
        this.actual = actual;
    }

    /**
     * Checksum recomputed from the entropy segment.
     */
    public String expected()
    {
        return expected;
    }

    /**
     * Checksum as it appeared in the candidate.
     */
    public String actual()
    {
        return actual;
    }
}
