package com.wpanther.memorygateway.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders every failure as an OAuth error body {@code {error, error_description}}.
 */
@ControllerAdvice
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
public class GlobalExceptionHandler {

    static final String BASIC_CHALLENGE = "Basic realm=\"oauth\"";

    @ExceptionHandler(OAuth2Exception.class)
    public ResponseEntity<Map<String, String>> handleOAuth2Exception(OAuth2Exception ex) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("OAuth2 error: {}", ex.getMessage(), ex);
        } else {
            log.debug("OAuth2 error {}: {}", ex.getError(), ex.getMessage());
        }

        ResponseEntity.BodyBuilder response = ResponseEntity.status(ex.getStatus())
                .cacheControl(CacheControl.noStore());
        if (OAuth2Exception.INVALID_CLIENT.equals(ex.getError()) && ex.getStatus() == HttpStatus.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, BASIC_CHALLENGE);
        }
        return response.body(errorBody(ex.getError(), ex.getMessage()));
    }

    @ExceptionHandler(ClientRegistrationException.class)
    public ResponseEntity<Map<String, String>> handleClientRegistrationException(ClientRegistrationException ex) {
        log.warn("Client registration error: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody(OAuth2Exception.INVALID_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest()
                .body(errorBody(OAuth2Exception.INVALID_REQUEST, ex.getParameterName() + " is required"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(errorBody(OAuth2Exception.INVALID_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        log.debug("Unsupported content type: {}", ex.getContentType());
        return ResponseEntity.badRequest()
                .body(errorBody(OAuth2Exception.INVALID_REQUEST,
                        "Content-Type must be application/x-www-form-urlencoded or application/json"));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, String>> handleStorageException(StorageException ex) {
        log.error("Storage error", ex);
        return serverError();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception ex) {
        if (ex instanceof ErrorResponse) {
            // framework errors such as 404 and 405 keep their status
            HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
            log.debug("Request rejected with {}: {}", status, ex.getMessage());
            return ResponseEntity.status(status).body(errorBody(OAuth2Exception.INVALID_REQUEST, ex.getMessage()));
        }
        log.error("Unexpected error", ex);
        return serverError();
    }

    private static ResponseEntity<Map<String, String>> serverError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(OAuth2Exception.SERVER_ERROR, "An unexpected error occurred"));
    }

    private static Map<String, String> errorBody(String error, String description) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("error_description", description);
        return body;
    }
}
