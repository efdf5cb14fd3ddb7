package com.feed.shield.gateway.core.cache;

import java.util.List;

public record LocalCacheStats(int size, int maxSize, List<String> keys) {
}
