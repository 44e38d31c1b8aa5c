package com.codeannotation.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class ApiLoggingFilterTest {

    @Test
    void caller_isAnonymousWithoutResolvedUser() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/version");

        assertThat(ApiLoggingFilter.caller(req)).isEqualTo("anonymous");
    }

    @Test
    void caller_isTheUserIdSetByAuthFilter() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/me");
        req.setAttribute(AuthFilter.USER_ID_ATTRIBUTE, 7);

        assertThat(ApiLoggingFilter.caller(req)).isEqualTo("7");
    }

    @Test
    void passesRequestThroughTheChain() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/experiments");
        MockHttpServletResponse res = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        new ApiLoggingFilter().doFilter(req, res, chain);

        assertThat(chain.getRequest()).isSameAs(req);
    }
}
