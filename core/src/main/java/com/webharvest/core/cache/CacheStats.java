package com.webharvest.core.cache;

import java.nio.file.Path;
import java.time.Duration;

/** @param dir 메모리 전용이면 null */
public record CacheStats(boolean enabled,
                         int memoryEntries,
                         int diskEntries,
                         long diskBytes,
                         Duration expiry,
                         Path dir,
                         long corruptedEntries) {}
