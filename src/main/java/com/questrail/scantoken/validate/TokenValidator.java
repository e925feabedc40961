package com.questrail.scantoken.validate;

import com.questrail.scantoken.api.ComponentRegistry;
import com.questrail.scantoken.api.ScannableToken;
import com.questrail.scantoken.codec.TokenChecksum;
import com.questrail.scantoken.error.ChecksumMismatchException;
import com.questrail.scantoken.error.MalformedTokenException;
import com.questrail.scantoken.error.RegistryUnavailableException;
import com.questrail.scantoken.error.ScannableTokenException;
import com.questrail.scantoken.error.UnallocatedComponentException;
import com.questrail.scantoken.grammar.ParseResult;
import com.questrail.scantoken.grammar.TokenMatch;
import com.questrail.scantoken.grammar.TokenParser;
import com.questrail.scantoken.observability.NullObservabilitySink;
import com.questrail.scantoken.observability.TokenErrorEvent;
import com.questrail.scantoken.observability.TokenObservabilitySink;
import com.questrail.scantoken.observability.ValidationFailureEvent;
import com.questrail.scantoken.time.SystemWallClock;
import com.questrail.scantoken.time.WallClock;

import java.util.Objects;

/**
 * TokenValidator
 * =============================================================================
 * Reverses the generator: turns a candidate string back into a
 * {@link ScannableToken}, or reports precisely why it cannot.
 *
 * <h2>Tiers, in order</h2>
 * <ol>
 *   <li><b>Grammar</b> - anchored parse of the whole candidate.
 *       Fails {@link MalformedTokenException} with the failing parser state.</li>
 *   <li><b>Checksum</b> - recompute CRC-32/Base62 over the entropy text and
 *       compare with the transmitted checksum. Fails
 *       {@link ChecksumMismatchException}.</li>
 *   <li><b>Registry</b> (optional) - only when a {@link ComponentRegistry} is
 *       supplied. Fails {@link UnallocatedComponentException}, or
 *       {@link RegistryUnavailableException} if the registry cannot answer.</li>
 * </ol>
 *
 * <p>The registry tier is optional so that scanning tools can validate
 * offline. Callers choose the strictness by choosing the overload.</p>
 *
 * <p>Pure apart from observability reporting; thread-safe.</p>
 */
public final class TokenValidator
{
    private final TokenObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public TokenValidator()
    {
        this(NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    public TokenValidator(TokenObservabilitySink observabilitySink, WallClock wallClock)
    {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Validates grammar and checksum only (offline mode).
     *
     * @throws MalformedTokenException if the candidate does not match the grammar
     * @throws ChecksumMismatchException if the checksum does not match the entropy
     */
    public ScannableToken validate(CharSequence candidate)
            throws MalformedTokenException, ChecksumMismatchException
    {
        Objects.requireNonNull(candidate, "candidate");

        final ParseResult result = TokenParser.parse(candidate);
        if (result instanceof ParseResult.Rejected rejected) {
            throw reported(new MalformedTokenException(
                    rejected.failedState(), rejected.reason(), rejected.offset()));
        }
        return confirmChecksum(((ParseResult.Accepted) result).match());
    }

    /**
     * Validates grammar, checksum, and registry membership.
     *
     * @throws MalformedTokenException if the candidate does not match the grammar
     * @throws ChecksumMismatchException if the checksum does not match the entropy
     * @throws UnallocatedComponentException if the component is not allocated
     * @throws RegistryUnavailableException if the registry could not answer
     */
    public ScannableToken validate(CharSequence candidate, ComponentRegistry registry)
            throws MalformedTokenException,
                   ChecksumMismatchException,
                   UnallocatedComponentException,
                   RegistryUnavailableException
    {
        Objects.requireNonNull(registry, "registry");

        final ScannableToken token = validate(candidate);
        requireAllocated(token.component(), registry);
        return token;
    }

    /**
     * Checksum tier for a structurally valid match.
     */
    ScannableToken confirmChecksum(TokenMatch match) throws ChecksumMismatchException
    {
        if (!TokenChecksum.matches(match.entropy(), match.checksum())) {
            throw reported(new ChecksumMismatchException(
                    TokenChecksum.compute(match.entropy()), match.checksum()));
        }
        return match.toToken();
    }

    /**
     * Registry tier.
     */
    void requireAllocated(String component, ComponentRegistry registry)
            throws UnallocatedComponentException, RegistryUnavailableException
    {
        final boolean allocated;
        try {
            allocated = registry.isAllocated(component);
        }
        catch (RegistryUnavailableException e) {
            observabilitySink.onError(new TokenErrorEvent(
                    wallClock.now(), "Registry lookup failed for component " + component, e));
            throw e;
        }

        if (!allocated) {
            throw reported(new UnallocatedComponentException(component));
        }
    }

    private <E extends ScannableTokenException> E reported(E failure)
    {
        observabilitySink.onValidationFailure(new ValidationFailureEvent(
                wallClock.now(), failure.kind(), failure.getMessage()));
        return failure;
    }
}
