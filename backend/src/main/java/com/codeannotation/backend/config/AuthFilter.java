package com.codeannotation.backend.config;

import com.codeannotation.backend.api.response.ErrorKind;
import com.codeannotation.backend.api.response.Response;
import com.codeannotation.backend.repo.TokenStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Attaches the caller's user id as the {@value #USER_ID_ATTRIBUTE} request attribute.
 *
 * <p>Requests without a bearer token pass through anonymous; handlers that need an identity
 * reject them. A token that resolves to nobody is answered with 401 right here.
 */
@Component
public class AuthFilter extends OncePerRequestFilter {

    public static final String USER_ID_ATTRIBUTE = "userId";

    private static final String BEARER = "Bearer ";

    private final TokenStore tokenStore;
    private final ObjectMapper om;

    public AuthFilter(TokenStore tokenStore, ObjectMapper om) {
        this.tokenStore = tokenStore;
        this.om = om;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest req,
            HttpServletResponse res,
            FilterChain chain
    ) throws ServletException, IOException {

        String auth = req.getHeader("Authorization");
        if (auth == null || !auth.startsWith(BEARER)) {
            chain.doFilter(req, res);
            return;
        }

        String token = auth.substring(BEARER.length()).trim();
        Integer userId = token.isEmpty() ? null : tokenStore.resolveUserId(token);
        if (userId == null) {
            unauthorized(res, "invalid token");
            return;
        }

        req.setAttribute(USER_ID_ATTRIBUTE, userId);
        chain.doFilter(req, res);
    }

    private void unauthorized(HttpServletResponse res, String title) throws IOException {
        Response body = Response.ofError(ErrorKind.UNAUTHENTICATED.error(title));
        res.setStatus(body.status());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        om.writeValue(res.getWriter(), body);
    }
}
