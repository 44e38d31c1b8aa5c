package com.codeannotation.backend.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire form of an {@link HttpError}: {@code {status, title, details?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetail(
        int status,
        String title,
        String details
) {}
