package com.questrail.scantoken.codec;

/**
 * Raised when Base62 text contains a character outside the alphabet.
 */
public final class Base62InvalidDigitException extends IllegalArgumentException
{
    private final int index;

    public Base62InvalidDigitException(char digit, int index)
    {
        super(String.format("Invalid base62 digit '%s' (U+%04X) at index %d", digit, (int) digit, index));
        this.index = index;
    }

    /**
     * Zero-based position of the offending character.
     */
    public int index()
    {
        return index;
    }
}
