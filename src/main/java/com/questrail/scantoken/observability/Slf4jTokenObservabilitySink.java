package com.questrail.scantoken.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TokenObservabilitySink that emits logs via SLF4J.
 *
 * <p>Only redacted token text reaches the log.</p>
 */
public final class Slf4jTokenObservabilitySink implements TokenObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTokenObservabilitySink.class);

    @Override
    public void onTokenGenerated(TokenGeneratedEvent event) {
        log.info("Token generated for component {}: {}", event.component(), event.redactedToken());
    }

    @Override
    public void onValidationFailure(ValidationFailureEvent event) {
        log.debug("Token rejected ({}): {}", event.kind(), event.detail());
    }

    @Override
    public void onDetection(DetectionEvent event) {
        var detection = event.detection();
        log.debug("Token detected at [{}, {}) confidence={}: {}",
            detection.start(),
            detection.end(),
            detection.confidence(),
            detection.token().redacted());
    }

    @Override
    public void onError(TokenErrorEvent event) {
        log.error("Token codec error: {}", event.message(), event.cause());
    }
}
