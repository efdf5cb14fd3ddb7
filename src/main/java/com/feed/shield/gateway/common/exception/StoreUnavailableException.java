package com.feed.shield.gateway.common.exception;

/**
 * Raised inside a store backend when the shared store cannot serve a call:
 * connection gated off, error reply, malformed response.
 * The remote store adapter converts it into a failed Result; it never reaches business code.
 */
public class StoreUnavailableException extends BaseShieldException {
    public static final String DEFAULT_ERROR_CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
