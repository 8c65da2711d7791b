package com.matcast.server.middleware;

import java.io.IOException;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Puts a {@code requestId} in the MDC for every HTTP request, including the
 * WebSocket upgrade, and echoes it as {@code X-Request-Id}. An inbound
 * {@code X-Request-Id} from a proxy is reused when it looks sane.
 */
@Component
@Order(0)
public class RequestCorrelationFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestCorrelationFilter.class);

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";

    private static final long SLOW_REQUEST_MS = 2000;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String requestId = resolveRequestId(httpRequest.getHeader(HEADER));
        long startTime = System.currentTimeMillis();

        try {
            MDC.put(MDC_REQUEST_ID, requestId);
            httpResponse.setHeader(HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            if (duration > SLOW_REQUEST_MS) {
                log.warn("[Slow Request] {} {} took {}ms (requestId={})",
                        httpRequest.getMethod(), httpRequest.getRequestURI(), duration, requestId);
            }
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    static String resolveRequestId(String inbound) {
        if (inbound != null && inbound.matches("[A-Za-z0-9\\-]{8,64}")) {
            return inbound;
        }
        return UUID.randomUUID().toString().substring(0, 12);
    }
}
