package com.tripmatch.server.filter;

import com.tripmatch.common.context.BaseContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * 请求级别的统一日志过滤器：
 * - 为每次 HTTP 请求生成或透传 traceId，写入 MDC 并回写响应头；
 * - 透传前端的 X-Session-Id（匿名浏览会话），写入 MDC 与 BaseContext，曝光日志按会话聚合时使用；
 * - 记录一次完整请求的方法、URI、HTTP 状态码与耗时。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class TraceLoggingFilter extends OncePerRequestFilter {

    static final String TRACE_ID_HEADER = "X-Trace-Id";
    static final String SESSION_ID_HEADER = "X-Session-Id";
    private static final String TRACE_ID_KEY = "traceId";
    private static final String SESSION_ID_KEY = "sessionId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();

        String incomingTraceId = request.getHeader(TRACE_ID_HEADER);
        String traceId = StringUtils.hasText(incomingTraceId) ? incomingTraceId : generateTraceId();
        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        String sessionId = request.getHeader(SESSION_ID_HEADER);
        if (StringUtils.hasText(sessionId)) {
            MDC.put(SESSION_ID_KEY, sessionId);
            BaseContext.setCurrentSessionId(sessionId);
        }

        try {
            log.info("HTTP 请求开始: traceId={}, method={}, uri={}, remoteIp={}",
                    traceId, request.getMethod(), request.getRequestURI(), request.getRemoteAddr());

            filterChain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - start;
            log.info("HTTP 请求结束: traceId={}, sessionId={}, method={}, uri={}, status={}, durationMs={}",
                    traceId, sessionId == null ? "null" : sessionId, request.getMethod(), request.getRequestURI(),
                    response.getStatus(), duration);

            // 清理 MDC 与 ThreadLocal，避免线程复用导致数据串线
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(SESSION_ID_KEY);
            BaseContext.clear();
        }
    }

    private String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
