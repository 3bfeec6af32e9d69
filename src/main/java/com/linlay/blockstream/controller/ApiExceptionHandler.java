package com.linlay.blockstream.controller;

import com.linlay.blockstream.block.PersistenceException;
import com.linlay.blockstream.model.api.ApiResponse;
import com.linlay.blockstream.persistence.MessageNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleIllegalArgument(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.failure(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(MessageNotFoundException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleMessageNotFound(MessageNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND,
                ApiResponse.failure(HttpStatus.NOT_FOUND, ex.getMessage(), Map.of("messageId", ex.messageId())));
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handlePersistence(PersistenceException ex) {
        log.error("Message store failure", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE,
                ApiResponse.failure(HttpStatus.SERVICE_UNAVAILABLE, "Message store unavailable"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        String message = ex.getReason();
        if (message == null || message.isBlank()) {
            HttpStatus httpStatus = HttpStatus.resolve(statusCode.value());
            message = httpStatus != null ? httpStatus.getReasonPhrase() : "Request failed";
        }
        return respond(statusCode, ApiResponse.failure(statusCode, message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleUnexpected(Exception ex) {
        log.error("Unhandled request failure", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                ApiResponse.failure(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    private static <T> ResponseEntity<ApiResponse<T>> respond(HttpStatusCode status, ApiResponse<T> body) {
        return ResponseEntity.status(status).body(body);
    }
}
