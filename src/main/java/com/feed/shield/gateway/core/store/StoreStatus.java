package com.feed.shield.gateway.core.store;

import java.util.List;

/**
 * Connectivity snapshot of the shared store for the introspection endpoint.
 *
 * @param keyCount approximate key count, or -1 when no backend answered
 */
public record StoreStatus(boolean configured, boolean connected, String activeBackend,
                          List<String> backends, long keyCount) {
}
