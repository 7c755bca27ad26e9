package com.convsync.api;

import com.convsync.api.dto.SyncStateResponse;
import com.convsync.auth.web.AuthContext;
import com.convsync.common.api.Result;
import com.convsync.domain.AccessDeniedException;
import com.convsync.domain.ClientSyncState;
import com.convsync.domain.ConversationAccessPolicy;
import com.convsync.domain.Identifiers;
import com.convsync.sync.ClientSyncStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * 查询当前用户某台设备在会话里的游标（只能查自己的）。没有记录时 data 为空。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/conversations")
public class SyncStateController {

    private final ClientSyncStateStore syncStateStore;
    private final ConversationAccessPolicy accessPolicy;

    @GetMapping("/{conversationId}/sync-state")
    public Result<SyncStateResponse> syncState(@PathVariable String conversationId,
                                               @RequestParam String clientId) {
        Identifiers.requireConversationId(conversationId);
        Identifiers.requireClientId(clientId);
        long userId = AuthContext.requireUserId();
        if (!accessPolicy.canAccess(userId, conversationId)) {
            throw new AccessDeniedException("forbidden");
        }
        ClientSyncState state = syncStateStore.get(userId, clientId, conversationId);
        return state == null ? Result.okVoid() : Result.ok(SyncStateResponse.from(state));
    }
}
