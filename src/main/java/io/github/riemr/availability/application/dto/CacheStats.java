package io.github.riemr.availability.application.dto;

import lombok.Value;

import java.util.List;

@Value
public class CacheStats {
    int size;
    int maxSize;
    List<CacheEntryStats> entries;
}
