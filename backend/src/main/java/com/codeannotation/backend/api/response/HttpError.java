package com.codeannotation.backend.api.response;

/**
 * A failure that knows which HTTP status it should be answered with.
 */
public interface HttpError {

    int statusCode();

    /**
     * Human readable message, never empty.
     */
    String getMessage();

    ErrorDetail toDetail();
}
