package com.questrail.devicelink.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>It may jump under NTP adjustment and MUST NOT drive timeouts, deadlines
 * or cache expiry; use {@link MonotonicClock} for those.</p>
 */
public interface WallClock
{
    Instant now();
}
