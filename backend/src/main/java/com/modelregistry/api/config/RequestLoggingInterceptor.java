package com.modelregistry.api.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Logs one line per registry call: the operation, the registry user who
 * made it, the response status and the duration.
 * <p>
 * User and model changes are logged at INFO so the log doubles as an audit
 * trail. Reads (search, get, list, download) are only logged at DEBUG.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String START_NANOS_ATTR = RequestLoggingInterceptor.class.getName() + ".startNanos";

    static final Set<String> REGISTRY_WRITES = Set.of(
            "/create_user",
            "/delete_user",
            "/store_model",
            "/upload_model",
            "/delete_model"
    );

    private static final String ANONYMOUS = "anonymous";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_NANOS_ATTR, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Long startNanos = (Long) request.getAttribute(START_NANOS_ATTR);
        long durationMs = startNanos != null
                ? TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)
                : 0;

        int status = response.getStatus();
        String operation = operationName(request, handler);
        String user = request.getRemoteUser() != null ? request.getRemoteUser() : ANONYMOUS;

        if (status >= 500) {
            log.error("Registry {} by {} failed with {} after {}ms{}",
                    operation, user, status, durationMs, ex != null ? ": " + ex.getMessage() : "");
        } else if (status >= 400) {
            log.warn("Registry {} by {} rejected with {} after {}ms",
                    operation, user, status, durationMs);
        } else if (isRegistryWrite(request)) {
            log.info("Registry {} by {} completed with {} in {}ms",
                    operation, user, status, durationMs);
        } else {
            log.debug("Registry {} by {} completed with {} in {}ms",
                    operation, user, status, durationMs);
        }
    }

    static boolean isRegistryWrite(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return REGISTRY_WRITES.contains(path);
    }

    /**
     * "METHOD /path (Controller#method)" when a controller handled the call,
     * otherwise just the method and path.
     */
    static String operationName(HttpServletRequest request, Object handler) {
        String call = request.getMethod() + " " + request.getRequestURI();
        if (handler instanceof HandlerMethod) {
            HandlerMethod handlerMethod = (HandlerMethod) handler;
            return call + " (" + handlerMethod.getBeanType().getSimpleName()
                    + "#" + handlerMethod.getMethod().getName() + ")";
        }
        return call;
    }
}
