package com.convsync.common.api;

/**
 * 统一错误码定义。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 无权访问该会话 */
    public static final int FORBIDDEN = 40300;

    /** 请求与当前状态冲突（例如同一 clientMsgId 正在发布中） */
    public static final int CONFLICT = 40900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 依赖的存储（日志/游标）暂不可用，可重试 */
    public static final int SERVICE_UNAVAILABLE = 50300;
}
