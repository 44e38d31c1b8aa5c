package com.codeannotation.backend.api.response;

import org.springframework.http.HttpStatus;

import java.util.Optional;

/**
 * The single concrete {@link HttpError}. Build instances through {@link ErrorKind}
 * or {@link Responses#newHttpError(int, String...)}.
 */
public class ApiException extends RuntimeException implements HttpError {

    private final int status;
    private final String title;
    private final String details;

    public ApiException(int status, String title) {
        this(status, title, null, null);
    }

    public ApiException(int status, String title, String details, Throwable cause) {
        super(title, cause);
        this.status = status;
        this.title = title == null ? "" : title;
        this.details = details;
    }

    @Override
    public int statusCode() {
        return status;
    }

    public String title() {
        return title;
    }

    public Optional<String> details() {
        return Optional.ofNullable(details);
    }

    public ApiException withDetails(String details) {
        ApiException copy = new ApiException(status, title, details, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    /**
     * Title, else the reason phrase of the status, else the reason phrase of 500.
     */
    @Override
    public String getMessage() {
        if (!title.isEmpty()) return title;

        HttpStatus known = HttpStatus.resolve(status);
        if (known != null) return known.getReasonPhrase();

        return HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase();
    }

    @Override
    public ErrorDetail toDetail() {
        return new ErrorDetail(status, getMessage(), details);
    }
}
