package com.questrail.scantoken.observability;

import java.time.Instant;

/**
 * Record representing a failure of an external collaborator (entropy source or
 * registry) rather than a rejected candidate.
 */
public record TokenErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
