package com.questrail.scantoken.observability;

import com.questrail.scantoken.error.TokenErrorKind;

import java.time.Instant;

/**
 * Record emitted when a candidate fails validation, either through a direct
 * {@code validate} call or during the detector's confirmation tiers.
 *
 * <p>{@code detail} is the failure message, which never contains entropy.</p>
 */
public record ValidationFailureEvent(
    Instant timestamp,
    TokenErrorKind kind,
    String detail
) {
}
