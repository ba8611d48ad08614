package com.streamgate.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * 统一 HTTP 链路日志过滤器。
 * <p>
 * 只记录请求行与耗时，不包装请求/响应体，避免缓冲 SSE 输出。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_HTTP_PATH = "httpPath";
    private static final String MDC_HTTP_METHOD = "httpMethod";
    private static final String ACTUATOR_PATH_PREFIX = "/actuator";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return StringUtils.startsWith(request.getRequestURI(), ACTUATOR_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreateHeader(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateHeader(request.getHeader(HEADER_REQUEST_ID));
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/");
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);

        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_HTTP_PATH, path);
        MDC.put(MDC_HTTP_METHOD, method);

        long startNs = System.nanoTime();
        log.info("HTTP_IN method={}, path={}, query={}, clientIp={}",
                method, path, StringUtils.defaultIfBlank(request.getQueryString(), "-"), resolveClientIp(request));
        Throwable error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            if (error == null) {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}, async={}",
                        method, path, response.getStatus(), costMs, request.isAsyncStarted());
            } else {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, errorType={}, errorMessage={}",
                        method, path, response.getStatus(), costMs,
                        error.getClass().getSimpleName(), error.getMessage());
            }
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_HTTP_PATH);
            MDC.remove(MDC_HTTP_METHOD);
        }
    }

    private String resolveOrCreateHeader(String value) {
        String normalized = StringUtils.trimToNull(value);
        if (normalized != null && normalized.length() <= 64) {
            return normalized;
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.isNotBlank(forwarded)) {
            String firstHop = StringUtils.trimToNull(StringUtils.substringBefore(forwarded, ","));
            if (firstHop != null) {
                return firstHop;
            }
        }
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

}
