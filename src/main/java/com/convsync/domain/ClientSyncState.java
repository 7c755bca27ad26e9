package com.convsync.domain;

/**
 * 某台设备在某个会话里的读游标。
 *
 * <p>同一个 (userId, clientId, conversationId) 下 lastMessageId 只增不减，由存储层保证。</p>
 */
public record ClientSyncState(
        String clientId,
        long userId,
        String conversationId,
        StreamEntryId lastMessageId,
        long lastSyncAt
) {

    public static ClientSyncState initial(long userId, String clientId, String conversationId) {
        return new ClientSyncState(clientId, userId, conversationId, StreamEntryId.BEGINNING, 0L);
    }

    public ClientSyncState withCursor(StreamEntryId cursor, long syncAtMs) {
        return new ClientSyncState(clientId, userId, conversationId, cursor, syncAtMs);
    }
}
