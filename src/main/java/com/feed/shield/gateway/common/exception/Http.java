package com.feed.shield.gateway.common.exception;

import com.feed.shield.gateway.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

public final class Http {

    public static final String RATE_LIMITED = "ERR-RATE-001";

    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        }
        return ResponseEntity.status(statusOf(r.getErrorCode())).body(body(r));
    }

    public static HttpStatus statusOf(String errorCode) {
        if (errorCode == null) return HttpStatus.BAD_REQUEST;
        return switch (errorCode) {
            case "ERR-VAL-001", "ERR-VAL-002", "ERR-REQ-003", "ERR-REQ-004" -> HttpStatus.BAD_REQUEST;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case UpstreamFetchFailedException.DEFAULT_ERROR_CODE,
                 UpstreamFetchFailedException.TIMEOUT_ERROR_CODE,
                 StoreUnavailableException.DEFAULT_ERROR_CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    public static ErrorResponse body(Result<?> r) {
        return new ErrorResponse(r.getErrorCode(), r.getError(), r.getTimestamp());
    }

    /**
     * Simple error response structure that will be returned to clients
     */
    public record ErrorResponse(String code, String message, Instant timestamp) {
    }
}
