package com.questrail.scantoken.observability;

import java.time.Instant;

/**
 * Record emitted after a token has been generated. Carries the redacted form
 * only.
 */
public record TokenGeneratedEvent(
    Instant timestamp,
    String component,
    String redactedToken
) {
}
