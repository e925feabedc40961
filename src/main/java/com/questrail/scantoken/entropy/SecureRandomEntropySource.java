package com.questrail.scantoken.entropy;

import com.questrail.scantoken.api.EntropySource;
import com.questrail.scantoken.error.EntropySourceException;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * SecureRandomEntropySource
 * =============================================================================
 * Production {@link EntropySource} backed by {@link SecureRandom}.
 *
 * <h2>Thread Safety</h2>
 * <p>{@link SecureRandom} is safe for concurrent use, so a single instance may
 * be shared by all generators. No additional locking is performed.</p>
 *
 * <h2>Failure</h2>
 * <p>Provider failures (for example an exhausted or unreadable OS entropy
 * handle) surface as {@link EntropySourceException}. There is no fallback.</p>
 */
public final class SecureRandomEntropySource implements EntropySource
{
    private final SecureRandom random;

    /**
     * Uses the platform's default {@link SecureRandom} (non-blocking on most
     * systems).
     */
    public SecureRandomEntropySource()
    {
        this(new SecureRandom());
    }

    public SecureRandomEntropySource(SecureRandom random)
    {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Uses {@link SecureRandom#getInstanceStrong()}, which may block while the
     * OS gathers entropy.
     *
     * @throws EntropySourceException if no strong algorithm is configured
     */
    public static SecureRandomEntropySource strong() throws EntropySourceException
    {
        try {
            return new SecureRandomEntropySource(SecureRandom.getInstanceStrong());
        }
        catch (NoSuchAlgorithmException e) {
            throw new EntropySourceException("No strong SecureRandom algorithm is available", e);
        }
    }

    @Override
    public byte[] nextBytes(int count) throws EntropySourceException
    {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative (was " + count + ")");
        }

        final byte[] out = new byte[count];
        try {
            random.nextBytes(out);
        }
        catch (RuntimeException e) {
            throw new EntropySourceException("SecureRandom failed to supply " + count + " bytes", e);
        }
        return out;
    }

    @Override
    public String toString()
    {
        return "SecureRandomEntropySource[" + random.getAlgorithm() + "]";
    }
}
