package com.questrail.scantoken.codec;

import com.questrail.scantoken.api.TokenFormat;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * TokenChecksum
 * -----------------------------------------------------------------------------
 * Computes and verifies the checksum segment of a token.
 *
 * <p>checksum = Base62(CRC-32(ASCII bytes of entropy), width 6). The CRC runs
 * over the entropy text exactly as written, never over a decoded form.</p>
 */
public final class TokenChecksum
{
    private TokenChecksum() {}

    /**
     * Returns the 6-character checksum for {@code entropy}.
     */
    public static String compute(CharSequence entropy)
    {
        Objects.requireNonNull(entropy, "entropy");
        return Base62.encode(Crc32.computeAscii(entropy), TokenFormat.CHECKSUM_LENGTH);
    }

    /**
     * Returns true if {@code checksum} equals the checksum recomputed from
     * {@code entropy}. The comparison does not short-circuit on the first
     * differing character.
     */
    public static boolean matches(CharSequence entropy, CharSequence checksum)
    {
        Objects.requireNonNull(checksum, "checksum");
        final String expected = compute(entropy);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                checksum.toString().getBytes(StandardCharsets.US_ASCII));
    }
}
