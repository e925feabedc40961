package com.questrail.scantoken.runtime;

import com.questrail.scantoken.api.ScannableToken;
import com.questrail.scantoken.config.ScannableTokenConfig;
import com.questrail.scantoken.error.ChecksumMismatchException;
import com.questrail.scantoken.error.EntropySourceException;
import com.questrail.scantoken.error.InvalidComponentFormatException;
import com.questrail.scantoken.error.MalformedTokenException;
import com.questrail.scantoken.error.RegistryUnavailableException;
import com.questrail.scantoken.error.UnallocatedComponentException;
import com.questrail.scantoken.generate.TokenGenerator;
import com.questrail.scantoken.validate.Detection;
import com.questrail.scantoken.validate.TokenDetector;
import com.questrail.scantoken.validate.TokenValidator;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * ScannableTokens
 * =============================================================================
 * Composition root for the token codec: wires generator, validator and
 * detector from one {@link ScannableTokenConfig}.
 *
 * <p>Instances hold no mutable state and may be shared across threads.</p>
 */
public final class ScannableTokens {
    private final ScannableTokenConfig config;
    private final TokenGenerator generator;
    private final TokenValidator validator;
    private final TokenDetector detector;

    private ScannableTokens(ScannableTokenConfig config) {
        this.config = config;
        this.generator = new TokenGenerator(
            config.registry(),
            config.entropySource(),
            config.observabilitySink(),
            config.wallClock());
        this.validator = new TokenValidator(config.observabilitySink(), config.wallClock());
        this.detector = new TokenDetector(
            validator,
            config.enforceRegistryOnDetect() ? config.registry() : null,
            config.observabilitySink(),
            config.wallClock());
    }

    public static ScannableTokens create(ScannableTokenConfig config) {
        return new ScannableTokens(Objects.requireNonNull(config, "config"));
    }

    public ScannableToken generate(String component)
            throws InvalidComponentFormatException,
                   UnallocatedComponentException,
                   RegistryUnavailableException,
                   EntropySourceException {
        return generator.generate(component);
    }

    /**
     * Validates {@code candidate}, consulting the registry when
     * {@link ScannableTokenConfig#enforceRegistryOnValidate()} is set.
     */
    public ScannableToken validate(CharSequence candidate)
            throws MalformedTokenException,
                   ChecksumMismatchException,
                   UnallocatedComponentException,
                   RegistryUnavailableException {
        if (config.enforceRegistryOnValidate()) {
            return validator.validate(candidate, config.registry());
        }
        return validator.validate(candidate);
    }

    public Stream<Detection> detect(CharSequence text) {
        return detector.detect(text);
    }

    public TokenGenerator generator() {
        return generator;
    }

    public TokenValidator validator() {
        return validator;
    }

    public TokenDetector detector() {
        return detector;
    }

    public ScannableTokenConfig config() {
        return config;
    }
}
