package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.ApiException;
import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.api.response.Responses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.*;

/**
 * Writes every failure in the error envelope shape {@code {status, errors: [{status, title, details?}]}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Response> handleApi(ApiException e) {
        if (e.statusCode() >= 500) {
            log.error("request failed: {}", e.getMessage(), e);
        } else {
            log.debug("request rejected with {}: {}", e.statusCode(), e.getMessage());
        }
        return Responses.toEntity(Response.ofError(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Response> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("unreadable request body: {}", e.getMessage());
        return Responses.toEntity(Response.ofError(ErrorKind.BAD_REQUEST.error("could not read request body")));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response> handleUnexpected(Exception e) {
        // routing errors from Spring MVC keep their own status
        if (e instanceof ErrorResponse) {
            int status = ((ErrorResponse) e).getStatusCode().value();
            return Responses.toEntity(Response.ofError(Responses.newHttpError(status)));
        }

        log.error("unexpected failure", e);
        return Responses.toEntity(Response.ofError(Responses.newHttpError(ErrorKind.INTERNAL.statusCode())));
    }
}
