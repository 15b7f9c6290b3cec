package com.multipost.web;

import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders request body, query parameter and payload parsing failures as one 400 shape.
 */
@RestControllerAdvice
public class RequestValidationExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleBody(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );
        return badRequest(fieldErrors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ValidationErrorResponse> handleParameters(HandlerMethodValidationException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getParameterValidationResults().forEach(result -> {
            String parameterName = result.getMethodParameter().getParameterName();
            String name = parameterName == null ? "parameter" : parameterName;
            result.getResolvableErrors().stream()
                    .map(MessageSourceResolvable::getDefaultMessage)
                    .findFirst()
                    .ifPresent(message -> fieldErrors.putIfAbsent(name, message));
        });
        return badRequest(fieldErrors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ValidationErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse("Malformed request body", Map.of()));
    }

    private static ResponseEntity<ValidationErrorResponse> badRequest(Map<String, String> fieldErrors) {
        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest()
                .body(new ValidationErrorResponse(detail, fieldErrors));
    }

    public record ValidationErrorResponse(
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
