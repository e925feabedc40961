package com.questrail.scantoken.generate;

import com.questrail.scantoken.api.ComponentRegistry;
import com.questrail.scantoken.api.EntropySource;
import com.questrail.scantoken.api.ScannableToken;
import com.questrail.scantoken.api.TokenFormat;
import com.questrail.scantoken.codec.TokenChecksum;
import com.questrail.scantoken.error.EntropySourceException;
import com.questrail.scantoken.error.InvalidComponentFormatException;
import com.questrail.scantoken.error.RegistryUnavailableException;
import com.questrail.scantoken.error.UnallocatedComponentException;
import com.questrail.scantoken.observability.NullObservabilitySink;
import com.questrail.scantoken.observability.TokenErrorEvent;
import com.questrail.scantoken.observability.TokenGeneratedEvent;
import com.questrail.scantoken.observability.TokenObservabilitySink;
import com.questrail.scantoken.time.SystemWallClock;
import com.questrail.scantoken.time.WallClock;

import java.util.Objects;

/**
 * TokenGenerator
 * =============================================================================
 * Produces new tokens for an allocated component.
 *
 * <h2>Steps, in order</h2>
 * <ol>
 *   <li>Component syntax check (3-6 lowercase letters). Fails
 *       {@link InvalidComponentFormatException} without touching the registry.</li>
 *   <li>Registry check. Fails {@link UnallocatedComponentException} without
 *       drawing entropy.</li>
 *   <li>27 entropy characters, each chosen uniformly from the Base62 alphabet.</li>
 *   <li>Checksum: Base62(CRC-32(entropy), width 6).</li>
 * </ol>
 *
 * <h2>Uniform selection</h2>
 * <p>Each random byte is reduced to its low six bits (0-63). Values 62 and 63
 * are discarded and replaced by further bytes, so every alphabet character is
 * equally likely. 27 characters carry about 160.7 bits of entropy.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Stateless apart from its collaborators; safe for concurrent use if the
 * entropy source and registry are.</p>
 */
public final class TokenGenerator
{
    /* low six bits of a byte; values >= 62 are rejected */
    private static final int SIX_BIT_MASK = 0x3F;

    /* bound on refill rounds so a broken source cannot loop forever */
    private static final int MAX_DRAW_ROUNDS = 32;

    private static final char[] ALPHABET = TokenFormat.BASE62_ALPHABET.toCharArray();

    private final ComponentRegistry registry;
    private final EntropySource entropySource;
    private final TokenObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public TokenGenerator(ComponentRegistry registry, EntropySource entropySource)
    {
        this(registry, entropySource, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public TokenGenerator(ComponentRegistry registry,
                          EntropySource entropySource,
                          TokenObservabilitySink observabilitySink,
                          WallClock wallClock)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.entropySource = Objects.requireNonNull(entropySource, "entropySource");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Generates a fresh token for {@code component}.
     *
     * @param component issuer namespace, 3-6 lowercase ASCII letters
     * @return the new token
     * @throws InvalidComponentFormatException if the component is syntactically invalid
     * @throws UnallocatedComponentException if the registry does not allocate it
     * @throws RegistryUnavailableException if the registry could not answer
     * @throws EntropySourceException if random bytes could not be obtained
     */
    public ScannableToken generate(String component)
            throws InvalidComponentFormatException,
                   UnallocatedComponentException,
                   RegistryUnavailableException,
                   EntropySourceException
    {
        if (!TokenFormat.isValidComponent(component)) {
            throw new InvalidComponentFormatException(component);
        }

        try {
            if (!registry.isAllocated(component)) {
                throw new UnallocatedComponentException(component);
            }
        }
        catch (RegistryUnavailableException e) {
            observabilitySink.onError(new TokenErrorEvent(
                    wallClock.now(), "Registry lookup failed for component " + component, e));
            throw e;
        }

        final String entropy;
        try {
            entropy = drawEntropy();
        }
        catch (EntropySourceException e) {
            observabilitySink.onError(new TokenErrorEvent(
                    wallClock.now(), "Entropy source failed while generating for component " + component, e));
            throw e;
        }

        final ScannableToken token = new ScannableToken(component, entropy, TokenChecksum.compute(entropy));

        observabilitySink.onTokenGenerated(new TokenGeneratedEvent(wallClock.now(), component, token.redacted()));
        return token;
    }

    private String drawEntropy() throws EntropySourceException
    {
        final char[] out = new char[TokenFormat.ENTROPY_LENGTH];
        int filled = 0;

        for (int round = 0; round < MAX_DRAW_ROUNDS && filled < out.length; round++) {
            final int requested = out.length - filled;
            final byte[] bytes = entropySource.nextBytes(requested);
            if (bytes == null || bytes.length != requested) {
                throw new EntropySourceException(
                        "Entropy source returned " + (bytes == null ? "null" : bytes.length + " bytes")
                                + ", expected " + requested);
            }

            for (byte b : bytes) {
                final int v = b & SIX_BIT_MASK;
                if (v < ALPHABET.length) {
                    out[filled++] = ALPHABET[v];
                }
            }
        }

        if (filled < out.length) {
            throw new EntropySourceException(
                    "Entropy source produced too few usable bytes after " + MAX_DRAW_ROUNDS + " rounds");
        }
        return new String(out);
    }
}
