package com.stockdiscussion.collector.collect.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One line when a request arrives and one when it completes; failed responses log at ERROR.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
        throws ServletException, IOException {
        long startedAt = System.nanoTime();
        String path = request.getRequestURI();
        log.info("--> {} {} from {}", request.getMethod(), path, request.getRemoteAddr());
        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("<-- 500 {} after {}ms", path, elapsedMillis(startedAt), e);
            throw e;
        }
        int status = response.getStatus();
        if (status >= 400) {
            log.error("<-- {} {} after {}ms", status, path, elapsedMillis(startedAt));
        } else {
            log.info("<-- {} {} after {}ms", status, path, elapsedMillis(startedAt));
        }
    }

    private static long elapsedMillis(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }
}
