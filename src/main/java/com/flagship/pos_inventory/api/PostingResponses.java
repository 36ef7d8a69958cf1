package com.flagship.pos_inventory.api;

import com.flagship.pos_inventory.posting.PostingError;
import com.flagship.pos_inventory.posting.PostingErrorCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a failed {@link com.flagship.pos_inventory.posting.PostingResult} as an HTTP response.
 *
 * Status mapping:
 * - VALIDATION: 400, except the *_NOT_FOUND codes which are 404
 * - BUSINESS_RULE and STATE_VIOLATION: 409
 * - TRANSIENT_STORAGE_FAILURE: 503 (client may retry with backoff)
 * - STORAGE_FAILURE: 500
 */
public final class PostingResponses {

    private PostingResponses() {
        // Utility class
    }

    public static ResponseEntity<ApiError> failure(PostingError error) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("code", error.getCode().name());
        details.put("category", error.getCode().getCategory().name());
        if (error.getProductCode() != null) {
            details.put("product_code", error.getProductCode());
        }
        if (error.getRequested() != null) {
            details.put("requested", String.valueOf(error.getRequested()));
        }
        if (error.getAvailable() != null) {
            details.put("available", String.valueOf(error.getAvailable()));
        }

        HttpStatus status = statusOf(error.getCode());
        ApiError body = ApiError.builder()
            .error(status.getReasonPhrase())
            .message(error.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    public static HttpStatus statusOf(PostingErrorCode code) {
        switch (code.getCategory()) {
            case VALIDATION:
                return code.name().endsWith("_NOT_FOUND") ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
            case BUSINESS_RULE:
            case STATE_VIOLATION:
                return HttpStatus.CONFLICT;
            default:
                return code.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
