package com.convsync.log;

/**
 * 日志读写失败（Redis 不可用、超时等）。调用方必须把 append 失败视为“未投递”。
 */
public class ConversationLogException extends RuntimeException {

    public ConversationLogException(String message) {
        super(message);
    }

    public ConversationLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
