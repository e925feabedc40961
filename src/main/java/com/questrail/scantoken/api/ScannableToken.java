package com.questrail.scantoken.api;

import java.util.Objects;

/**
 * Immutable value representation of a structurally valid scannable token.
 *
 * <h2>What this represents</h2>
 * <p>
 * A {@code ScannableToken} is either freshly produced by the generator or
 * reconstructed by the validator from an external string. In both cases the
 * three variable segments have already been checked against the token grammar;
 * the constructor re-checks the segment shapes so that a malformed instance is
 * unrepresentable.
 * </p>
 *
 * <p>
 * The constructor does <em>not</em> verify the checksum against the entropy.
 * That is the validator's job, because only the validator can report the
 * failure as a distinct, recoverable error kind.
 * </p>
 *
 * <h2>Secrecy</h2>
 * <p>
 * Tokens are secret. {@link #toString()} returns the {@link #redacted()} form;
 * callers that need the full wire text must ask for it explicitly through
 * {@link #value()}.
 * </p>
 *
 * <h2>Equality</h2>
 * <p>
 * Equality and hash code are based on all three segments. Two tokens are equal
 * exactly when their wire strings are equal.
 * </p>
 */
public final class ScannableToken
{
    private final String component;
    private final String entropy;
    private final String checksum;

    public ScannableToken(String component, String entropy, String checksum)
    {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(entropy, "entropy");
        Objects.requireNonNull(checksum, "checksum");

        if (!TokenFormat.isValidComponent(component)) {
            throw new IllegalArgumentException(
                    "component must be " + TokenFormat.MIN_COMPONENT_LENGTH + "-"
                            + TokenFormat.MAX_COMPONENT_LENGTH + " lowercase ASCII letters (was \""
                            + component + "\")");
        }
        if (!isBase62(entropy, TokenFormat.ENTROPY_LENGTH)) {
            throw new IllegalArgumentException(
                    "entropy must be exactly " + TokenFormat.ENTROPY_LENGTH + " base62 characters");
        }
        if (!isBase62(checksum, TokenFormat.CHECKSUM_LENGTH)
                || !TokenFormat.isChecksumLeadChar(checksum.charAt(0))) {
            throw new IllegalArgumentException(
                    "checksum must be " + TokenFormat.CHECKSUM_LENGTH
                            + " base62 characters starting with 0-4 (was \"" + checksum + "\")");
        }

        this.component = component;
        this.entropy = entropy;
        this.checksum = checksum;
    }

    /**
     * Returns the literal prefix, always {@value TokenFormat#PREFIX}.
     */
    public String prefix()
    {
        return TokenFormat.PREFIX;
    }

    public String component()
    {
        return component;
    }

    /**
     * Returns the 27-character random segment. Treat as secret.
     */
    public String entropy()
    {
        return entropy;
    }

    public String checksum()
    {
        return checksum;
    }

    /**
     * Returns the full wire form {@code asf_<component>_<entropy><checksum>}.
     */
    public String value()
    {
        return TokenFormat.PREFIX_WITH_SEPARATOR + component + TokenFormat.SEPARATOR + entropy + checksum;
    }

    /**
     * Total wire length, 41-44 characters depending on the component.
     */
    public int length()
    {
        return TokenFormat.PREFIX_WITH_SEPARATOR.length()
                + component.length() + 1
                + TokenFormat.ENTROPY_LENGTH
                + TokenFormat.CHECKSUM_LENGTH;
    }

    /**
     * Returns a log-safe rendering with the entropy segment masked, e.g.
     * {@code asf_sample_***2MvMGi}.
     */
    public String redacted()
    {
        return TokenFormat.PREFIX_WITH_SEPARATOR + component + TokenFormat.SEPARATOR + "***" + checksum;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ScannableToken that)) return false;
        return component.equals(that.component)
                && entropy.equals(that.entropy)
                && checksum.equals(that.checksum);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(component, entropy, checksum);
    }

    @Override
    public String toString()
    {
        return "ScannableToken[" + redacted() + "]";
    }

    private static boolean isBase62(String s, int expectedLength)
    {
        if (s.length() != expectedLength) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!TokenFormat.isBase62Char(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
