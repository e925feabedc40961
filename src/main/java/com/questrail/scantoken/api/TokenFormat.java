package com.questrail.scantoken.api;

/**
 * TokenFormat
 * -----------------------------------------------------------------------------
 * Wire-format constants for scannable {@code asf_} tokens.
 *
 * <p>A token on the wire has the shape:</p>
 *
 * <pre>
 *   asf_ &lt;component&gt; _ &lt;entropy&gt; &lt;checksum&gt;
 *        3-6 [a-z]        27 base62  6 base62, first digit [0-4]
 * </pre>
 *
 * <p>The checksum is the Base62 rendering (width 6) of the IEEE 802.3 CRC-32
 * of the entropy segment's ASCII bytes. Because {@code 0xFFFFFFFF} renders as
 * {@code 4gfFC3}, no checksum can start with a digit whose value exceeds 4.</p>
 *
 * <p>The total length of a token is therefore between {@value #MIN_TOKEN_LENGTH}
 * and {@value #MAX_TOKEN_LENGTH} characters.</p>
 */
public final class TokenFormat
{
    /** Literal issuer prefix, without the trailing separator. */
    public static final String PREFIX = "asf";

    /** Segment separator. */
    public static final char SEPARATOR = '_';

    /** Prefix plus its separator; every token starts with this text. */
    public static final String PREFIX_WITH_SEPARATOR = PREFIX + SEPARATOR;

    /**
     * Base62 alphabet. The order is load-bearing: index in this string is the
     * digit value.
     */
    public static final String BASE62_ALPHABET =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    public static final int MIN_COMPONENT_LENGTH = 3;
    public static final int MAX_COMPONENT_LENGTH = 6;

    public static final int ENTROPY_LENGTH = 27;
    public static final int CHECKSUM_LENGTH = 6;

    /** Highest digit value permitted as the first checksum character ({@code '4'}). */
    public static final int MAX_CHECKSUM_LEADING_DIGIT = 4;

    public static final int MIN_TOKEN_LENGTH =
            PREFIX_WITH_SEPARATOR.length() + MIN_COMPONENT_LENGTH + 1 + ENTROPY_LENGTH + CHECKSUM_LENGTH;

    public static final int MAX_TOKEN_LENGTH =
            PREFIX_WITH_SEPARATOR.length() + MAX_COMPONENT_LENGTH + 1 + ENTROPY_LENGTH + CHECKSUM_LENGTH;

    /**
     * Unanchored detection pattern, published verbatim for third-party secret
     * scanners. This library never compiles it; matching is done by
     * {@code com.questrail.scantoken.grammar.TokenScanner}.
     */
    public static final String PUBLISHED_PATTERN =
            "asf_([a-z]{3,6})_([0-9A-Za-z]{27})([0-4][0-9A-Za-z]{5})";

    private TokenFormat() {}

    /**
     * Returns true if {@code component} is 3-6 lowercase ASCII letters.
     */
    public static boolean isValidComponent(String component)
    {
        if (component == null) {
            return false;
        }
        final int len = component.length();
        if (len < MIN_COMPONENT_LENGTH || len > MAX_COMPONENT_LENGTH) {
            return false;
        }
        for (int i = 0; i < len; i++) {
            if (!isComponentChar(component.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isComponentChar(char c)
    {
        return c >= 'a' && c <= 'z';
    }

    public static boolean isBase62Char(char c)
    {
        return (c >= '0' && c <= '9')
                || (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z');
    }

    /**
     * Returns true if {@code c} may start a checksum segment ({@code '0'}-{@code '4'}).
     */
    public static boolean isChecksumLeadChar(char c)
    {
        return c >= '0' && c <= (char) ('0' + MAX_CHECKSUM_LEADING_DIGIT);
    }
}
