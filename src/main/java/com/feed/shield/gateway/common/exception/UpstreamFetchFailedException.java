package com.feed.shield.gateway.common.exception;

/**
 * Thrown when a fetch function failed (or timed out) and no cached value
 * of any age is left to serve. Callers see it as "temporarily unavailable".
 */
public class UpstreamFetchFailedException extends BaseShieldException {
    public static final String DEFAULT_ERROR_CODE = "ERR-UPSTREAM-001";
    public static final String TIMEOUT_ERROR_CODE = "ERR-UPSTREAM-TIMEOUT";

    private final String cacheKey;

    public UpstreamFetchFailedException(String cacheKey, String message, Throwable cause) {
        super(message, cause);
        this.cacheKey = cacheKey;
    }

    public UpstreamFetchFailedException(String cacheKey, String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
