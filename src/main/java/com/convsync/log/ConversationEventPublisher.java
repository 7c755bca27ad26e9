package com.convsync.log;

import com.convsync.config.ConversationLogProperties;
import com.convsync.domain.BroadcastEvent;
import com.convsync.domain.StreamEntryId;
import com.convsync.gateway.broadcast.LocalBroadcastRegistry;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 发布入口：append 到日志，然后交给实时广播。
 *
 * <p>local fan-out 模式下 append 与本地广播在同一把按会话分段的锁内完成，使本地广播顺序等于 id 顺序；
 * stream fan-out 模式下只 append，由 {@link ConversationFanoutListener} 从指针流里按顺序广播。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationEventPublisher {

    private static final int STRIPES = 64;

    private final ConversationLog conversationLog;
    private final LocalBroadcastRegistry registry;
    private final ConversationLogProperties props;
    private final PublishIdempotency idempotency;

    private final Object[] stripes = newStripes();

    @Value
    public static class PublishResult {
        StreamEntryId streamEntryId;
        boolean duplicate;
    }

    /**
     * append 并投递；失败抛 {@link ConversationLogException}，调用方视为“未投递”。
     */
    public StreamEntryId publish(String conversationId, String payload) {
        if (props.streamFanout()) {
            return conversationLog.append(conversationId, payload);
        }
        synchronized (stripe(conversationId)) {
            LogEntry entry = conversationLog.appendEntry(conversationId, payload);
            registry.publish(conversationId, BroadcastEvent.durable(conversationId, entry.id(), entry.payload(), entry.producedAt()));
            return entry.id();
        }
    }

    /**
     * 带 clientMsgId 的幂等发布：同一 (userId, conversationId, clientMsgId) 重试返回第一次的 id。
     */
    public PublishResult publish(long userId, String conversationId, String payload, String clientMsgId) {
        if (clientMsgId == null || clientMsgId.isBlank()) {
            return new PublishResult(publish(conversationId, payload), false);
        }
        String key = idempotency.key(userId, conversationId, clientMsgId);
        PublishIdempotency.Claim claim = new PublishIdempotency.Claim();
        PublishIdempotency.Claim existed = idempotency.putIfAbsent(key, claim);
        if (existed != null) {
            StreamEntryId id = existed.getStreamEntryId();
            if (id == null) {
                throw new PublishInProgressException("publish_in_progress");
            }
            return new PublishResult(id, true);
        }
        try {
            StreamEntryId id = publish(conversationId, payload);
            claim.setStreamEntryId(id);
            return new PublishResult(id, false);
        } catch (RuntimeException e) {
            idempotency.remove(key);
            throw e;
        }
    }

    private Object stripe(String conversationId) {
        return stripes[Math.floorMod(conversationId == null ? 0 : conversationId.hashCode(), STRIPES)];
    }

    private static Object[] newStripes() {
        Object[] out = new Object[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            out[i] = new Object();
        }
        return out;
    }
}
