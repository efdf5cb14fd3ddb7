package com.feed.shield.gateway.common.exception;

import lombok.Getter;

/**
 * Base exception class for all gateway exceptions.
 * Carries a stable error code that ends up in the error response body.
 */
@Getter
public abstract class BaseShieldException extends RuntimeException {

    private final String errorCode;

    protected BaseShieldException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseShieldException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseShieldException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
