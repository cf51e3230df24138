package com.nft.marketplace.nft_marketplace.web;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.nft.marketplace.nft_marketplace.exception.LedgerException;

/**
 * Maps rejected operations to HTTP statuses with a {@code {"error", "message"}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, String>> handleLedgerException(LedgerException e) {
        HttpStatus status = switch (e.getErrorCode()) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT, INVALID_STATE -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status)
                .body(Map.of("error", e.getErrorCode().name(), "message", e.getMessage()));
    }

    @ExceptionHandler({ IllegalArgumentException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "INVALID_INPUT", "message", "Malformed request"));
    }
}
