package com.convsync.domain;

/**
 * 会话成员校验（外部协作方：会话/成员管理不在本服务内）。
 *
 * <p>在 WS 握手与 HTTP 发布入口调用；实现可能是阻塞的，调用方会放到 IO 线程池执行。</p>
 */
public interface ConversationAccessPolicy {

    boolean canAccess(long userId, String conversationId);
}
