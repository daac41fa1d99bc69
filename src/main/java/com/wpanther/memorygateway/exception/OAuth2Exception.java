package com.wpanther.memorygateway.exception;

import org.springframework.http.HttpStatus;

/**
 * OAuth protocol error rendered as {@code {error, error_description}}.
 */
public class OAuth2Exception extends RuntimeException {

    public static final String INVALID_REQUEST = "invalid_request";
    public static final String INVALID_CLIENT = "invalid_client";
    public static final String INVALID_GRANT = "invalid_grant";
    public static final String UNSUPPORTED_GRANT_TYPE = "unsupported_grant_type";
    public static final String UNSUPPORTED_RESPONSE_TYPE = "unsupported_response_type";
    public static final String INVALID_TOKEN = "invalid_token";
    public static final String ACCESS_DENIED = "access_denied";
    public static final String SERVER_ERROR = "server_error";

    private final String error;
    private final HttpStatus status;

    public OAuth2Exception(String error, String description) {
        this(error, description, defaultStatus(error));
    }

    public OAuth2Exception(String error, String description, HttpStatus status) {
        super(description);
        this.error = error;
        this.status = status;
    }

    public OAuth2Exception(String error, String description, Throwable cause) {
        super(description, cause);
        this.error = error;
        this.status = defaultStatus(error);
    }

    public String getError() {
        return error;
    }

    public HttpStatus getStatus() {
        return status;
    }

    private static HttpStatus defaultStatus(String error) {
        if (INVALID_CLIENT.equals(error) || INVALID_TOKEN.equals(error)) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (SERVER_ERROR.equals(error)) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
