package com.codeannotation.backend.api;

import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.config.AuthFilter;
import jakarta.servlet.http.HttpServletRequest;

final class RequestIdentity {

    private RequestIdentity() {
    }

    /**
     * @throws com.codeannotation.backend.api.response.ApiException 401 when no user is attached
     */
    static int getUserId(HttpServletRequest req) {
        Object userId = req.getAttribute(AuthFilter.USER_ID_ATTRIBUTE);
        if (!(userId instanceof Integer)) {
            throw ErrorKind.UNAUTHENTICATED.error();
        }
        return (Integer) userId;
    }
}
