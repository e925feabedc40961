package com.questrail.scantoken.validate;

import com.questrail.scantoken.api.ScannableToken;

import java.util.Objects;

/**
 * A token found in free text that passed the detector's confirmation tiers.
 *
 * <p>{@code start} is inclusive and {@code end} exclusive, relative to the
 * scanned text. {@link #toString()} is redacted.</p>
 */
public record Detection(
        ScannableToken token,
        int start,
        int end,
        Confidence confidence
) {
    /**
     * How far a detection was confirmed.
     */
    public enum Confidence
    {
        /** Grammar and checksum verified; registry not consulted or unavailable. */
        CHECKSUM_VERIFIED,

        /** Grammar, checksum, and registry membership verified. */
        REGISTRY_CONFIRMED
    }

    public Detection {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(confidence, "confidence");
    }

    @Override
    public String toString()
    {
        return "Detection[" + start + ".." + end + ", " + confidence + ", " + token.redacted() + "]";
    }
}
