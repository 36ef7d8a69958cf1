package com.flagship.pos_inventory.posting;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;

/**
 * Outcome of a posting operation: either a value or a {@link PostingError}, never both.
 *
 * Engines return business failures through this type instead of throwing,
 * so callers can render every outcome without catching exceptions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PostingResult<T> {
    T value;
    PostingError error;

    public static <T> PostingResult<T> success(T value) {
        return new PostingResult<>(value, null);
    }

    public static <T> PostingResult<T> failure(PostingError error) {
        return new PostingResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public boolean hasError(PostingErrorCode code) {
        return error != null && error.getCode() == code;
    }

    /**
     * Returns the value, or throws if this result is a failure.
     *
     * @throws IllegalStateException carrying the error message
     */
    public T orElseThrow() {
        if (error != null) {
            throw new IllegalStateException(error.getCode() + ": " + error.getMessage());
        }
        return value;
    }
}
