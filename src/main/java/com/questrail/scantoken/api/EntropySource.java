package com.questrail.scantoken.api;

import com.questrail.scantoken.error.EntropySourceException;

/**
 * EntropySource
 * -----------------------------------------------------------------------------
 * Supplier of uniformly random bytes for token generation.
 *
 * <h2>Binding invariant</h2>
 * Production implementations MUST be cryptographically secure. Token
 * unguessability depends entirely on this source; there is no fallback to a
 * weaker generator when it fails.
 *
 * <p>
 * Deterministic implementations are permitted in tests only, where they are
 * used to reproduce known token vectors.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * Implementations must be safe to call concurrently and should not hold a lock
 * for longer than the byte fetch itself.
 */
@FunctionalInterface
public interface EntropySource
{
    /**
     * Returns {@code count} fresh random bytes.
     *
     * @throws EntropySourceException if the bytes could not be supplied
     */
    byte[] nextBytes(int count) throws EntropySourceException;
}
