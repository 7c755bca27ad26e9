package com.convsync.api;

import com.convsync.api.dto.PublishEventRequest;
import com.convsync.api.dto.PublishEventResponse;
import com.convsync.auth.web.AuthContext;
import com.convsync.common.api.Result;
import com.convsync.domain.AccessDeniedException;
import com.convsync.domain.ConversationAccessPolicy;
import com.convsync.domain.Identifiers;
import com.convsync.log.ConversationEventPublisher;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

/**
 * 生产方写入口：append 到会话日志并实时推给在线订阅者。
 */
@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/conversations")
public class ConversationEventController {

    private final ConversationEventPublisher publisher;
    private final ConversationAccessPolicy accessPolicy;

    @PostMapping("/{conversationId}/events")
    public Result<PublishEventResponse> publish(@PathVariable String conversationId,
                                                @Valid @RequestBody PublishEventRequest request) {
        Identifiers.requireConversationId(conversationId);
        long userId = AuthContext.requireUserId();
        if (!accessPolicy.canAccess(userId, conversationId)) {
            throw new AccessDeniedException("forbidden");
        }
        ConversationEventPublisher.PublishResult r =
                publisher.publish(userId, conversationId, request.payload(), request.clientMsgId());
        if (r.isDuplicate()) {
            log.debug("publish deduplicated: userId={}, conversationId={}, clientMsgId={}, streamEntryId={}",
                    userId, conversationId, request.clientMsgId(), r.getStreamEntryId());
        }
        return Result.ok(new PublishEventResponse(conversationId, r.getStreamEntryId().toString(), r.isDuplicate()));
    }
}
