package com.convsync.sync;

import com.convsync.domain.ClientSyncState;

/**
 * 设备读游标存储，key 为 (userId, clientId, conversationId)。
 *
 * <p>约定：</p>
 * <ul>
 *   <li>get：从未见过或已过期（TTL 默认 30 天）返回 null，不是错误</li>
 *   <li>put：upsert 并刷新 TTL；游标只前进，传入更旧的 lastMessageId 时只刷新 TTL/lastSyncAt</li>
 *   <li>存储异常抛 {@link SyncStateStoreException}</li>
 * </ul>
 */
public interface ClientSyncStateStore {

    ClientSyncState get(long userId, String clientId, String conversationId);

    /**
     * @return 游标是否前进（false 表示被单调性拒绝，只刷新了 TTL）
     */
    boolean put(ClientSyncState state);
}
