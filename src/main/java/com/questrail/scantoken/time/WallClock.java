package com.questrail.scantoken.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability event timestamps.
 *
 * <p>
 * No token operation depends on time for correctness; this seam exists so that
 * tests can assert on exact event timestamps.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
