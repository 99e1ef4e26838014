package com.questrail.steward.dispatch.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for event arrival stamps and observability.
 * It MUST NOT drive dedup, rate limiting or acknowledgment deadlines.
 */
public interface WallClock
{
    Instant now();
}
