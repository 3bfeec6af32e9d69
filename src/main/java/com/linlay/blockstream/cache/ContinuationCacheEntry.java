package com.linlay.blockstream.cache;

import java.time.Instant;

public record ContinuationCacheEntry<V>(
        String key,
        V value,
        Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
