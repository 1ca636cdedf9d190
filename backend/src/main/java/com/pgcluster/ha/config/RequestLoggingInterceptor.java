package com.pgcluster.ha.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs method, URI, response status and duration of cluster API requests.
 * Membership changes are logged at INFO, status reads at DEBUG.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final String START_TIME_ATTR = "requestStartTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.currentTimeMillis());

        if (log.isDebugEnabled()) {
            log.debug("Request: {} {} from {}",
                    request.getMethod(),
                    request.getRequestURI(),
                    getClientIp(request));
        }

        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Long startTime = (Long) request.getAttribute(START_TIME_ATTR);
        long duration = startTime != null ? System.currentTimeMillis() - startTime : 0;

        int status = response.getStatus();
        String method = request.getMethod();
        String uri = request.getRequestURI();

        if (status >= 500) {
            log.error("Response: {} {} -> {} ({}ms){}",
                    method, uri, status, duration,
                    ex != null ? " - " + ex.getMessage() : "");
        } else if (status >= 400) {
            log.warn("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
        } else if (isMembershipChange(method)) {
            log.info("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
        } else {
            log.debug("Response: {} {} -> {} ({}ms)", method, uri, status, duration);
        }
    }

    private boolean isMembershipChange(String method) {
        return "POST".equals(method) || "DELETE".equals(method);
    }

    /**
     * Client IP, honouring X-Forwarded-For when the API sits behind a proxy.
     */
    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
