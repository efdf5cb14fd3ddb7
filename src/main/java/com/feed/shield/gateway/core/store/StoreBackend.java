package com.feed.shield.gateway.core.store;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One way of reaching the shared key/value store.
 *
 * Contracts:
 *  - {@link #execute(List)} sends every command in one round trip where the transport allows it
 *    and completes with one normalized reply per command, in order.
 *  - Failures complete the future exceptionally; the adapter turns them into "unavailable".
 *  - {@link #isAvailable()} must be cheap; it gates calls before any I/O is attempted.
 */
public interface StoreBackend {

    String name();

    boolean isAvailable();

    CompletableFuture<List<Object>> execute(List<StoreCommand> commands);

    /**
     * Approximate number of keys in the store, for dashboards.
     */
    CompletableFuture<Long> keyCount();

    /**
     * Deletes every key starting with {@code keyPrefix} (namespace excluded).
     *
     * @return number of deleted keys
     */
    CompletableFuture<Long> deleteByPrefix(String keyPrefix);
}
