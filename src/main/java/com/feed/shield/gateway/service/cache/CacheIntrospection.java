package com.feed.shield.gateway.service.cache;

import com.feed.shield.gateway.core.cache.LocalCacheStats;
import com.feed.shield.gateway.core.store.StoreStatus;

public record CacheIntrospection(LocalCacheStats local, StoreStatus remote, int inFlight) {
}
