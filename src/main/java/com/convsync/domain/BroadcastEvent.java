package com.convsync.domain;

/**
 * 一次实时投递的事件。
 *
 * <p>{@code streamEntryId} 由日志分配；为 null 时表示“瞬时信号”（例如正在输入），不入日志、不推进游标。</p>
 *
 * @param originToken  发起方订阅的标识，仅瞬时信号使用，用于不回显给发起方
 * @param originUserId 瞬时信号的发起方 userId
 */
public record BroadcastEvent(
        String conversationId,
        StreamEntryId streamEntryId,
        String payload,
        long producedAt,
        String originToken,
        Long originUserId
) {

    public static BroadcastEvent durable(String conversationId, StreamEntryId id, String payload, long producedAt) {
        if (id == null) {
            throw new IllegalArgumentException("streamEntryId is null");
        }
        return new BroadcastEvent(conversationId, id, payload, producedAt, null, null);
    }

    public static BroadcastEvent signal(String conversationId, String payload, long producedAt, String originToken, long originUserId) {
        return new BroadcastEvent(conversationId, null, payload, producedAt, originToken, originUserId);
    }

    public boolean isEphemeral() {
        return streamEntryId == null;
    }
}
