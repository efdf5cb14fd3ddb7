package com.feed.shield.gateway.common.exception;

/**
 * Exception thrown when a request parameter is malformed, e.g. an analytics date key.
 */
public class ValidationException extends BaseShieldException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
