package com.questrail.scantoken.validate;

import com.questrail.scantoken.api.ComponentRegistry;
import com.questrail.scantoken.api.ScannableToken;
import com.questrail.scantoken.error.ChecksumMismatchException;
import com.questrail.scantoken.error.RegistryUnavailableException;
import com.questrail.scantoken.error.UnallocatedComponentException;
import com.questrail.scantoken.grammar.TokenMatch;
import com.questrail.scantoken.grammar.TokenScanner;
import com.questrail.scantoken.observability.DetectionEvent;
import com.questrail.scantoken.observability.NullObservabilitySink;
import com.questrail.scantoken.observability.TokenObservabilitySink;
import com.questrail.scantoken.time.SystemWallClock;
import com.questrail.scantoken.time.WallClock;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * TokenDetector
 * =============================================================================
 * Finds leaked tokens in unstructured text (log lines, source files, chat
 * transcripts) for secret-scanning tools.
 *
 * <h2>Two-tier strategy, plus an optional third</h2>
 * <pre>
 *   free text
 *        → TokenScanner            (cheap structural match, non-overlapping)
 *            → checksum tier       (discard near-misses: false-positive filter)
 *                → registry tier   (optional: discard unallocated components)
 *                    → Detection
 * </pre>
 *
 * <p>If the registry cannot answer for a candidate, the detection is kept at
 * {@link Detection.Confidence#CHECKSUM_VERIFIED} and the outage is reported
 * through the observability sink. A scanner should over-report rather than
 * miss a leak because a lookup failed.</p>
 *
 * <p>Detection is lazy: {@link #detect(CharSequence)} returns a stream that
 * scans only as far as it is consumed.</p>
 */
public final class TokenDetector
{
    private final TokenValidator validator;
    private final ComponentRegistry registry;
    private final TokenObservabilitySink observabilitySink;
    private final WallClock wallClock;

    /**
     * Offline detector: grammar and checksum tiers only.
     */
    public TokenDetector()
    {
        this(new TokenValidator(), null, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    /**
     * @param registry registry for the third tier, or {@code null} for offline detection
     */
    public TokenDetector(TokenValidator validator,
                         ComponentRegistry registry,
                         TokenObservabilitySink observabilitySink,
                         WallClock wallClock)
    {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.registry = registry;
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Returns true if this detector applies the registry tier.
     */
    public boolean usesRegistry()
    {
        return registry != null;
    }

    /**
     * Lazily detects confirmed tokens in {@code text}, in order of appearance.
     */
    public Stream<Detection> detect(CharSequence text)
    {
        return detect(text, 0);
    }

    /**
     * Lazily detects confirmed tokens in {@code text} starting at offset {@code from}.
     */
    public Stream<Detection> detect(CharSequence text, int from)
    {
        return TokenScanner.over(text, from).stream()
                .map(this::confirm)
                .flatMap(Optional::stream);
    }

    /**
     * Eagerly collects every confirmed token in {@code text}.
     */
    public List<Detection> detectAll(CharSequence text)
    {
        return detect(text).collect(Collectors.toList());
    }

    /**
     * Returns true if {@code text} contains at least one confirmed token.
     * Stops scanning at the first one.
     */
    public boolean containsToken(CharSequence text)
    {
        return detect(text).findFirst().isPresent();
    }

    private Optional<Detection> confirm(TokenMatch match)
    {
        final ScannableToken token;
        try {
            token = validator.confirmChecksum(match);
        }
        catch (ChecksumMismatchException e) {
            // near-miss; the validator has already reported it
            return Optional.empty();
        }

        Detection.Confidence confidence = Detection.Confidence.CHECKSUM_VERIFIED;
        if (registry != null) {
            try {
                validator.requireAllocated(token.component(), registry);
                confidence = Detection.Confidence.REGISTRY_CONFIRMED;
            }
            catch (UnallocatedComponentException e) {
                return Optional.empty();
            }
            catch (RegistryUnavailableException e) {
                // reported by the validator; the detection stays at checksum confidence
                confidence = Detection.Confidence.CHECKSUM_VERIFIED;
            }
        }

        final Detection detection = new Detection(token, match.start(), match.end(), confidence);
        observabilitySink.onDetection(new DetectionEvent(wallClock.now(), detection));
        return Optional.of(detection);
    }
}
