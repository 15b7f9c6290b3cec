package com.multipost.network;

import lombok.Getter;
import org.springframework.http.HttpStatusCode;

/**
 * A publish call that did not go through. Permanent failures are never retried.
 */
@Getter
public class PublishFailureException extends RuntimeException {

    private final boolean permanent;

    public PublishFailureException(boolean permanent, String message, Throwable cause) {
        super(message, cause);
        this.permanent = permanent;
    }

    public static PublishFailureException permanent(String message) {
        return new PublishFailureException(true, message, null);
    }

    public static PublishFailureException transientFailure(String message, Throwable cause) {
        return new PublishFailureException(false, message, cause);
    }

    /**
     * 5xx and 429 are worth another try. Every other error status means the request itself is wrong.
     */
    public static PublishFailureException fromHttpStatus(
            String networkCode,
            HttpStatusCode statusCode,
            String responseBody,
            Throwable cause
    ) {
        String message = networkCode + " API returned " + statusCode.value()
                + (responseBody == null || responseBody.isBlank() ? "" : ": " + responseBody.trim());
        boolean retryable = statusCode.is5xxServerError() || statusCode.value() == 429;
        return new PublishFailureException(!retryable, message, cause);
    }
}
