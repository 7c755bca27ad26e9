package com.convsync.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一 HTTP 返回对象。
 *
 * <ul>
 *   <li>ok：业务是否成功（不是 HTTP 状态码）</li>
 *   <li>code：成功固定为 0；失败见 {@link ApiCodes}</li>
 *   <li>message：简短原因</li>
 *   <li>data：成功时的数据</li>
 *   <li>ts：服务端响应时间戳（毫秒）</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean ok,
        int code,
        String message,
        T data,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, "ok", data, System.currentTimeMillis());
    }

    /**
     * 成功但无业务数据。不能命名为 ok()，会和 record 的 ok() 访问器冲突。
     */
    public static <T> Result<T> okVoid() {
        return new Result<>(true, 0, "ok", null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, System.currentTimeMillis());
    }
}
