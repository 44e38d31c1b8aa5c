package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.ErrorKind;

final class UrlParams {

    private UrlParams() {
    }

    static int intParam(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            throw ErrorKind.BAD_REQUEST.error("missing parameter", name);
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw ErrorKind.BAD_REQUEST.error("wrong format in parameter", name + ";", "expected integer");
        }
    }
}
