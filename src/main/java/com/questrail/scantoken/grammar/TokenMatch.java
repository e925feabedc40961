package com.questrail.scantoken.grammar;

import com.questrail.scantoken.api.ScannableToken;
import com.questrail.scantoken.api.TokenFormat;

import java.util.Objects;

/**
 * A span of input text that satisfies the token grammar.
 *
 * <p>Structural only: the checksum has not been verified. {@code start} is
 * inclusive and {@code end} exclusive, both relative to the scanned text.</p>
 */
public record TokenMatch(
        int start,
        int end,
        String component,
        String entropy,
        String checksum
) {
    public TokenMatch {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(entropy, "entropy");
        Objects.requireNonNull(checksum, "checksum");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Slices a match out of {@code text} given its start offset and the
     * component length reported by the state machine.
     */
    static TokenMatch slice(CharSequence text, int start, int componentLength)
    {
        final int componentStart = start + TokenFormat.PREFIX_WITH_SEPARATOR.length();
        final int entropyStart = componentStart + componentLength + 1;
        final int checksumStart = entropyStart + TokenFormat.ENTROPY_LENGTH;
        final int end = checksumStart + TokenFormat.CHECKSUM_LENGTH;

        return new TokenMatch(
                start,
                end,
                text.subSequence(componentStart, componentStart + componentLength).toString(),
                text.subSequence(entropyStart, checksumStart).toString(),
                text.subSequence(checksumStart, end).toString());
    }

    public int length()
    {
        return end - start;
    }

    /**
     * Returns the matched wire text.
     */
    public String text()
    {
        return TokenFormat.PREFIX_WITH_SEPARATOR + component + TokenFormat.SEPARATOR + entropy + checksum;
    }

    /**
     * Converts this match into a token value. Does not verify the checksum.
     */
    public ScannableToken toToken()
    {
        return new ScannableToken(component, entropy, checksum);
    }

    @Override
    public String toString()
    {
        return "TokenMatch[" + start + ".." + end + ", component=" + component + "]";
    }
}
