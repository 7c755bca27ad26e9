package com.convsync.log;

import com.convsync.config.ConversationLogProperties;
import com.convsync.domain.BroadcastEvent;
import com.convsync.domain.StreamEntryId;
import com.convsync.gateway.broadcast.LiveSubscription;
import com.convsync.gateway.broadcast.LocalBroadcastRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.connection.stream.StreamRecords;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ConversationFanoutListenerTest {

    private static final String FANOUT_KEY = "im:stream:fanout";

    private StringRedisTemplate redis;
    private StreamOperations<String, Object, Object> streamOps;
    private ConversationLog conversationLog;
    private LocalBroadcastRegistry registry;
    private ConversationFanoutListener listener;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        streamOps = mock(StreamOperations.class);
        when(redis.<Object, Object>opsForStream()).thenReturn(streamOps);
        when(streamOps.reverseRange(eq(FANOUT_KEY), any(), any(Limit.class))).thenReturn(List.of());
        conversationLog = mock(ConversationLog.class);
        registry = new LocalBroadcastRegistry(null);
        ConversationLogProperties props = new ConversationLogProperties(null, null, null, "stream", null, null, 10L, 10);
        listener = new ConversationFanoutListener(redis, conversationLog, registry, props);
    }

    @Test
    void backoffShouldGrowExponentiallyAndCap() {
        assertEquals(200, ConversationFanoutListener.backoffMs(0));
        assertEquals(200, ConversationFanoutListener.backoffMs(1));
        assertEquals(400, ConversationFanoutListener.backoffMs(2));
        assertEquals(800, ConversationFanoutListener.backoffMs(3));
        assertEquals(5000, ConversationFanoutListener.backoffMs(10));
    }

    @Test
    void pollOnce_ShouldLookUpEntryAndBroadcastToLocalSubscribers() {
        LiveSubscription sub = registry.subscribe("c1");
        StreamEntryId entryId = StreamEntryId.of(100, 1);
        when(streamOps.read(any(StreamReadOptions.class), any(StreamOffset.class)))
                .thenReturn(List.of(pointer("200-0", "c1", entryId.toString())));
        when(conversationLog.get("c1", entryId)).thenReturn(new LogEntry(entryId, "hello", 100L));

        assertEquals(1, listener.pollOnce());

        BroadcastEvent e = sub.poll();
        assertNotNull(e);
        assertEquals(entryId, e.streamEntryId());
        assertEquals("hello", e.payload());
        assertFalse(e.isEphemeral());
    }

    @Test
    void pollOnce_ShouldSkipConversationsWithoutLocalSubscribers() {
        when(streamOps.read(any(StreamReadOptions.class), any(StreamOffset.class)))
                .thenReturn(List.of(pointer("200-0", "nobody-here", "100-1")));

        assertEquals(1, listener.pollOnce());

        verifyNoInteractions(conversationLog);
    }

    @Test
    void pollOnce_ShouldIgnoreTrimmedEntriesAndMalformedPointers() {
        LiveSubscription sub = registry.subscribe("c1");
        when(streamOps.read(any(StreamReadOptions.class), any(StreamOffset.class)))
                .thenReturn(List.of(pointer("200-0", "c1", "100-1"), pointer("201-0", "c1", "not-an-id")));
        when(conversationLog.get(eq("c1"), any())).thenReturn(null);

        assertEquals(2, listener.pollOnce());
        assertNull(sub.poll());
    }

    @Test
    void pollOnce_ShouldReturnZeroWhenNothingArrived() {
        when(streamOps.read(any(StreamReadOptions.class), any(StreamOffset.class))).thenReturn(List.of());

        assertEquals(0, listener.pollOnce());
    }

    private static MapRecord<String, Object, Object> pointer(String id, String conversationId, String entryId) {
        Map<Object, Object> fields = new HashMap<>();
        fields.put(RedisStreamConversationLog.FIELD_CONVERSATION_ID, conversationId);
        fields.put(RedisStreamConversationLog.FIELD_ENTRY_ID, entryId);
        return StreamRecords.newRecord().in(FANOUT_KEY).withId(RecordId.of(id)).ofMap(fields);
    }
}
