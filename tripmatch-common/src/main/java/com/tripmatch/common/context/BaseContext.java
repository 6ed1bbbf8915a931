package com.tripmatch.common.context;

/**
 * 保存当前请求的会话 ID（基于 ThreadLocal），由请求过滤器写入，用于日志串联。
 */
public class BaseContext {

    private static final ThreadLocal<String> CURRENT_SESSION_ID = new ThreadLocal<>();

    private BaseContext() {
    }

    public static void setCurrentSessionId(String sessionId) {
        CURRENT_SESSION_ID.set(sessionId);
    }

    public static String getCurrentSessionId() {
        return CURRENT_SESSION_ID.get();
    }

    public static void clear() {
        CURRENT_SESSION_ID.remove();
    }
}
