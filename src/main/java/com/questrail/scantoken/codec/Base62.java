package com.questrail.scantoken.codec;

import com.questrail.scantoken.api.TokenFormat;

import java.util.Arrays;
import java.util.Objects;

/**
 * Base62
 * -----------------------------------------------------------------------------
 * Fixed-width conversion between non-negative integers and Base62 text.
 *
 * <p>The alphabet is {@link TokenFormat#BASE62_ALPHABET}: {@code 0-9} (values
 * 0-9), {@code A-Z} (10-35), {@code a-z} (36-61). Output is most-significant
 * digit first and left-padded with {@code '0'}.</p>
 *
 * <p>All methods are pure and thread-safe.</p>
 */
public final class Base62
{
    public static final int RADIX = 62;

    /*
     * Largest width whose full range (62^width - 1) still fits in a signed long.
     * 62^10 ~ 8.4e17 < Long.MAX_VALUE ~ 9.2e18 < 62^11.
     */
    private static final int MAX_BOUNDED_WIDTH = 10;

    private static final char[] DIGITS = TokenFormat.BASE62_ALPHABET.toCharArray();

    /* ASCII code point -> digit value, -1 for characters outside the alphabet */
    private static final int[] VALUES = new int[128];

    static {
        Arrays.fill(VALUES, -1);
        for (int i = 0; i < DIGITS.length; i++) {
            VALUES[DIGITS[i]] = i;
        }
    }

    private Base62() {}

    /**
     * Renders {@code value} as exactly {@code width} Base62 digits.
     *
     * @param value non-negative value to encode
     * @param width number of output characters, at least 1
     * @return Base62 text of length {@code width}
     * @throws Base62EncodingOverflowException if {@code value >= 62^width}
     * @throws IllegalArgumentException if {@code value} is negative or
     *         {@code width} is less than 1
     */
    public static String encode(long value, int width)
    {
        if (value < 0) {
            throw new IllegalArgumentException("Base62 value must be non-negative (was " + value + ")");
        }
        if (width < 1) {
            throw new IllegalArgumentException("Base62 width must be at least 1 (was " + width + ")");
        }
        if (width <= MAX_BOUNDED_WIDTH && value >= pow62(width)) {
            throw new Base62EncodingOverflowException(
                    "Value " + value + " does not fit in " + width + " base62 digits");
        }

        final char[] out = new char[width];
        Arrays.fill(out, DIGITS[0]);

        // Remainders come out least-significant first; fill from the right.
        long remaining = value;
        int w = width - 1;
        while (remaining > 0) {
            out[w--] = DIGITS[(int) (remaining % RADIX)];
            remaining /= RADIX;
        }
        return new String(out);
    }

    /**
     * Parses Base62 text, most-significant digit first.
     *
     * @throws Base62InvalidDigitException if any character is outside the alphabet
     * @throws Base62EncodingOverflowException if the value exceeds {@link Long#MAX_VALUE}
     */
    public static long decode(CharSequence text)
    {
        Objects.requireNonNull(text, "text");

        long acc = 0;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            final int digit = digitValue(c);
            if (digit < 0) {
                throw new Base62InvalidDigitException(c, i);
            }
            try {
                acc = Math.addExact(Math.multiplyExact(acc, RADIX), digit);
            }
            catch (ArithmeticException e) {
                throw new Base62EncodingOverflowException(
                        "Base62 text of length " + text.length() + " exceeds the range of a long");
            }
        }
        return acc;
    }

    /**
     * Returns the digit value of {@code c}, or -1 if it is not a Base62 digit.
     */
    public static int digitValue(char c)
    {
        return (c < VALUES.length) ? VALUES[c] : -1;
    }

    private static long pow62(int width)
    {
        long p = 1;
        for (int i = 0; i < width; i++) {
            p *= RADIX;
        }
        return p;
    }
}
