package com.codeannotation.backend.api.response;

import com.codeannotation.backend.api.dto.Payload;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body of every API response: {@code {status, data?, errors?}}.
 * A status of 0 marks the empty sentinel from {@link Responses#newEmptyResponse()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Response(
        int status,
        Payload data,
        List<ErrorDetail> errors
) {
    public Response {
        errors = errors == null ? null : List.copyOf(errors);
    }

    public static Response ofError(HttpError error) {
        return new Response(error.statusCode(), null, List.of(error.toDetail()));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return status == 0 && data == null && errors == null;
    }
}
