package com.csd.pkghealth.service;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached payload with its capture time. Valid while {@code now - timestamp <= ttl}.
 */
@Value
public class CacheEntry<T> {
    T data;
    Instant timestamp;
    Duration ttl;

    public boolean isValid(Instant now) {
        return Duration.between(timestamp, now).compareTo(ttl) <= 0;
    }
}
