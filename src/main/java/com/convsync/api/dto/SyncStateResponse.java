package com.convsync.api.dto;

import com.convsync.domain.ClientSyncState;

public record SyncStateResponse(
        String clientId,
        Long userId,
        String conversationId,
        String lastMessageId,
        Long lastSyncAt
) {

    public static SyncStateResponse from(ClientSyncState s) {
        return new SyncStateResponse(
                s.clientId(),
                s.userId(),
                s.conversationId(),
                s.lastMessageId().toString(),
                s.lastSyncAt());
    }
}
