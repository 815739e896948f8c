package com.boqregistry.api.controller;

import com.boqregistry.api.dto.ErrorBody;
import com.boqregistry.classification.ClassificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures and ClassificationException to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ClassificationException.class)
    public ResponseEntity<ErrorBody> handleClassification(ClassificationException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        log.debug("Classification request rejected with {}: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case ClassificationException.ITEM_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ClassificationException.DUPLICATE_ROW_POSITION,
                 ClassificationException.RECLASSIFY_NOT_CONFIRMED -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
    }
}
