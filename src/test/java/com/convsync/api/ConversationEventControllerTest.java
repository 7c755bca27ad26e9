package com.convsync.api;

import com.convsync.MutableClock;
import com.convsync.api.dto.PublishEventRequest;
import com.convsync.api.dto.PublishEventResponse;
import com.convsync.auth.web.AuthContext;
import com.convsync.common.api.Result;
import com.convsync.config.ConversationLogProperties;
import com.convsync.config.PublishIdempotencyProperties;
import com.convsync.domain.AccessDeniedException;
import com.convsync.domain.BroadcastEvent;
import com.convsync.domain.StreamEntryId;
import com.convsync.gateway.broadcast.LiveSubscription;
import com.convsync.gateway.broadcast.LocalBroadcastRegistry;
import com.convsync.log.ConversationEventPublisher;
import com.convsync.log.InMemoryConversationLog;
import com.convsync.log.PublishIdempotency;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class ConversationEventControllerTest {

    private final InMemoryConversationLog conversationLog =
            new InMemoryConversationLog(new MutableClock(1_700_000_000_000L), Duration.ofDays(30));
    private final LocalBroadcastRegistry registry = new LocalBroadcastRegistry(null);
    private final ConversationEventPublisher publisher = new ConversationEventPublisher(
            conversationLog, registry,
            new ConversationLogProperties(null, null, null, null, null, null, null, null),
            new PublishIdempotency(new PublishIdempotencyProperties()));

    private final ConversationEventController controller =
            new ConversationEventController(publisher, (userId, conversationId) -> !conversationId.startsWith("private"));

    @AfterEach
    void clear() {
        AuthContext.clear();
    }

    @Test
    void publish_ShouldAppendAndDeliverLive() {
        AuthContext.setUserId(7L);
        LiveSubscription sub = registry.subscribe("c1");

        Result<PublishEventResponse> r = controller.publish("c1", new PublishEventRequest("hello", null));

        assertTrue(r.ok());
        assertEquals("c1", r.data().conversationId());
        assertFalse(r.data().duplicate());
        StreamEntryId id = StreamEntryId.parse(r.data().streamEntryId());
        assertEquals("hello", conversationLog.get("c1", id).payload());
        BroadcastEvent live = sub.poll();
        assertNotNull(live);
        assertEquals(id, live.streamEntryId());
    }

    @Test
    void publish_ShouldDeduplicateRetriedClientMsgId() {
        AuthContext.setUserId(7L);

        Result<PublishEventResponse> first = controller.publish("c1", new PublishEventRequest("hello", "m-1"));
        Result<PublishEventResponse> retry = controller.publish("c1", new PublishEventRequest("hello", "m-1"));

        assertTrue(retry.data().duplicate());
        assertEquals(first.data().streamEntryId(), retry.data().streamEntryId());
        assertEquals(1, conversationLog.readSince("c1", StreamEntryId.BEGINNING).size());
    }

    @Test
    void publish_ShouldRejectInvalidConversationAndDeniedAccess() {
        AuthContext.setUserId(7L);

        assertThatThrownBy(() -> controller.publish("bad id", new PublishEventRequest("x", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("invalid_conversation_id");
        assertThatThrownBy(() -> controller.publish("private-1", new PublishEventRequest("x", null)))
                .isInstanceOf(AccessDeniedException.class);
        assertNull(conversationLog.latestId("private-1"));
    }

    @Test
    void publish_ShouldRequireAuthenticatedUser() {
        assertThatThrownBy(() -> controller.publish("c1", new PublishEventRequest("x", null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("unauthenticated");
    }
}
