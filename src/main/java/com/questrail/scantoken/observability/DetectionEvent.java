package com.questrail.scantoken.observability;

import com.questrail.scantoken.validate.Detection;

import java.time.Instant;

/**
 * Record emitted for every confirmed detection in scanned text.
 */
public record DetectionEvent(
    Instant timestamp,
    Detection detection
) {
}
