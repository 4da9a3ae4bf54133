package io.github.riemr.availability.application.dto;

import lombok.Value;

@Value
public class CacheEntryStats {
    String key;
    long ageSeconds;
    long ttlSeconds;
}
