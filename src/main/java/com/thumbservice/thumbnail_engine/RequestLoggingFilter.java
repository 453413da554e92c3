package com.thumbservice.thumbnail_engine;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Logs each request and exposes its full URL to the log pattern as {@code %X{url}}.
 */
@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    public static final String MDC_URL_KEY = "url";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        StringBuilder url = new StringBuilder(req.getRequestURL());
        if (req.getQueryString() != null) {
            url.append('?').append(req.getQueryString());
        }
        MDC.put(MDC_URL_KEY, url.toString());
        try {
            long startTime = System.currentTimeMillis();
            logger.debug("Incoming request: {} {} from {}", req.getMethod(), req.getRequestURI(), req.getRemoteAddr());
            chain.doFilter(request, response);
            long duration = System.currentTimeMillis() - startTime;
            int status = response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
            logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), req.getRequestURI(), status, duration);
        } finally {
            MDC.remove(MDC_URL_KEY);
        }
    }
}
