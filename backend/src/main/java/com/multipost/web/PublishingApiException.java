package com.multipost.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collection;

@Getter
public class PublishingApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public PublishingApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static PublishingApiException notFound(String detail) {
        return new PublishingApiException(
                HttpStatus.NOT_FOUND,
                "not_found",
                detail
        );
    }

    public static PublishingApiException invalidNetwork(Collection<String> invalidNetworks) {
        return new PublishingApiException(
                HttpStatus.BAD_REQUEST,
                "invalid_network",
                "Unknown networks: " + String.join(", ", invalidNetworks)
        );
    }

    public static PublishingApiException validation(String detail) {
        return new PublishingApiException(
                HttpStatus.BAD_REQUEST,
                "validation_error",
                detail
        );
    }

    public static PublishingApiException conflict(String detail) {
        return new PublishingApiException(
                HttpStatus.CONFLICT,
                "conflict",
                detail
        );
    }

    public static PublishingApiException dispatchFailed(String detail) {
        return new PublishingApiException(
                HttpStatus.SERVICE_UNAVAILABLE,
                "dispatch_failed",
                detail
        );
    }
}
