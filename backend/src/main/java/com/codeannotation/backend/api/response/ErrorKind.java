package com.codeannotation.backend.api.response;

import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy of the request handlers.
 */
public enum ErrorKind {
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public int statusCode() {
        return status.value();
    }

    public ApiException error(String... messageParts) {
        return Responses.newHttpError(status.value(), messageParts);
    }

    /**
     * Keeps {@code cause} for the logs, only {@code context} reaches the client.
     */
    public ApiException wrap(String context, Throwable cause) {
        return new ApiException(status.value(), context, null, cause);
    }
}
