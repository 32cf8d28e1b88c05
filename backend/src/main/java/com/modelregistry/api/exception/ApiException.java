package com.modelregistry.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Service-layer error carrying the HTTP status it should be reported with.
 */
@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status;

    public ApiException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public ApiException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
