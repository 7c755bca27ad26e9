package com.convsync.auth.web;

/**
 * 请求级别的当前用户。
 *
 * <p>ThreadLocal 必须在请求结束时清理（AccessTokenInterceptor#afterCompletion），否则线程复用时会串号。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    /**
     * 取当前用户；未登录视为调用方错误（拦截器应已拒绝）。
     */
    public static long requireUserId() {
        Long uid = USER_ID.get();
        if (uid == null) {
            throw new IllegalStateException("unauthenticated");
        }
        return uid;
    }

    public static void clear() {
        USER_ID.remove();
    }
}
