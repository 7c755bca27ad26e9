package com.convsync.log;

/**
 * 同一个 clientMsgId 的上一次 append 尚未完成。
 */
public class PublishInProgressException extends RuntimeException {

    public PublishInProgressException(String message) {
        super(message);
    }
}
