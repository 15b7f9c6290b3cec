package com.multipost.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class PublishingApiExceptionHandler {

    @ExceptionHandler(PublishingApiException.class)
    public ResponseEntity<PublishingErrorResponse> handle(PublishingApiException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new PublishingErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record PublishingErrorResponse(
            String code,
            String message
    ) {
    }
}
