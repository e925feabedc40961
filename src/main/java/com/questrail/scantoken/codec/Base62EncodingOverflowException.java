package com.questrail.scantoken.codec;

/**
 * Raised when a value cannot be rendered in the requested number of Base62
 * digits without truncation, or when decoded text exceeds the range of a
 * {@code long}.
 *
 * <p>Indicates codec misuse; never raised by the generator or validator.</p>
 */
public final class Base62EncodingOverflowException extends IllegalArgumentException
{
    public Base62EncodingOverflowException(String message)
    {
        super(message);
    }
}
