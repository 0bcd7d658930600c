package com.tennis.edge.signal;

import java.time.Instant;

/**
 * Cache entry holding the first signal seen for a match and when it was stored.
 */
public record CachedSignal(
    MatchSignal opening,
    Instant storedAt
) {}
