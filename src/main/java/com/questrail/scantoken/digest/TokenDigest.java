package com.questrail.scantoken.digest;

import com.questrail.scantoken.api.ScannableToken;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * TokenDigest
 * -----------------------------------------------------------------------------
 * SHA3-256 digest of a token's wire text, for storing issued tokens without
 * storing the secret itself.
 *
 * <p>An issuer keeps only {@link #sha3Hex(ScannableToken)} and later checks a
 * presented token with {@link #matches(CharSequence, String)}. The comparison
 * runs in time independent of where the digests differ.</p>
 *
 * <p>Persistence of digests is the caller's concern.</p>
 */
public final class TokenDigest
{
    public static final String ALGORITHM = "SHA3-256";

    private static final HexFormat HEX = HexFormat.of();

    private TokenDigest() {}

    /**
     * Lowercase hex SHA3-256 of the token's wire text (64 characters).
     */
    public static String sha3Hex(ScannableToken token)
    {
        Objects.requireNonNull(token, "token");
        return sha3Hex(token.value());
    }

    /**
     * Lowercase hex SHA3-256 of {@code tokenText} encoded as UTF-8.
     */
    public static String sha3Hex(CharSequence tokenText)
    {
        Objects.requireNonNull(tokenText, "tokenText");
        return HEX.formatHex(digest(tokenText));
    }

    /**
     * Returns true if {@code presented} hashes to {@code storedHex}.
     * {@code storedHex} is compared case-insensitively.
     */
    public static boolean matches(CharSequence presented, String storedHex)
    {
        Objects.requireNonNull(presented, "presented");
        Objects.requireNonNull(storedHex, "storedHex");

        final byte[] computed = HEX.formatHex(digest(presented)).getBytes(StandardCharsets.US_ASCII);
        final byte[] stored = storedHex.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(computed, stored);
    }

    private static byte[] digest(CharSequence text)
    {
        final MessageDigest md;
        try {
            md = MessageDigest.getInstance(ALGORITHM);
        }
        catch (NoSuchAlgorithmException e) {
            // SHA3-256 is a mandatory algorithm on every Java 9+ platform.
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
        return md.digest(text.toString().getBytes(StandardCharsets.UTF_8));
    }
}
