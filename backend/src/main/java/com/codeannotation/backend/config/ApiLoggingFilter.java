package com.codeannotation.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One line per API call. Runs outside {@link AuthFilter}, so the caller resolved there is known
 * once the chain returns.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiLoggingFilter.class);

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        long started = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            log.info("[API] {} {} user={} -> {} ({}ms)",
                    req.getMethod(), req.getRequestURI(), caller(req), res.getStatus(), elapsedMs);
        }
    }

    static String caller(HttpServletRequest req) {
        Object userId = req.getAttribute(AuthFilter.USER_ID_ATTRIBUTE);
        return userId == null ? "anonymous" : userId.toString();
    }
}
