package com.convsync.sync;

import com.convsync.config.SyncStateProperties;
import com.convsync.domain.ClientSyncState;
import com.convsync.domain.StreamEntryId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class RedisClientSyncStateStoreTest {

    private StringRedisTemplate redis;
    private HashOperations<String, Object, Object> hashOps;
    private RedisClientSyncStateStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        hashOps = mock(HashOperations.class);
        when(redis.<Object, Object>opsForHash()).thenReturn(hashOps);
        store = new RedisClientSyncStateStore(redis, new SyncStateProperties(null, 30, null, 60_000L));
    }

    @Test
    void get_ShouldReadHashUnderDeviceKey() {
        when(hashOps.entries("im:sync:cursor:1:dev-a:c1")).thenReturn(Map.<Object, Object>of(
                "lastMessageId", "100-5",
                "lastSyncAt", "1700000000000",
                "clientId", "dev-a"));

        ClientSyncState s = store.get(1L, "dev-a", "c1");

        assertNotNull(s);
        assertEquals(StreamEntryId.of(100, 5), s.lastMessageId());
        assertEquals(1700000000000L, s.lastSyncAt());
        assertEquals("dev-a", s.clientId());
        assertEquals(1L, s.userId());
    }

    @Test
    void get_ShouldReturnNullForMissingOrCorruptState() {
        when(hashOps.entries(anyString())).thenReturn(Map.<Object, Object>of());
        assertNull(store.get(1L, "dev-a", "c1"));

        when(hashOps.entries(anyString())).thenReturn(Map.<Object, Object>of("lastMessageId", "garbage"));
        assertNull(store.get(1L, "dev-a", "c1"));
    }

    @Test
    void put_ShouldPassCursorAndTtlToScript() {
        when(redis.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(),
                anyString(), anyString(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(1L);

        boolean applied = store.put(new ClientSyncState("dev-a", 1L, "c1", StreamEntryId.of(100, 5), 42L));

        assertTrue(applied);
        verify(redis).execute(ArgumentMatchers.<RedisScript<Long>>any(),
                eq(List.of("im:sync:cursor:1:dev-a:c1")),
                eq("100-5"), eq("dev-a"), eq("1"), eq("c1"), eq("42"), eq(String.valueOf(30L * 24 * 3600)));
    }

    @Test
    void put_ShouldReportNotAppliedWhenScriptKeepsNewerCursor() {
        when(redis.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(),
                anyString(), anyString(), anyString(), anyString(), anyString(), anyString()))
                .thenReturn(0L);

        assertFalse(store.put(new ClientSyncState("dev-a", 1L, "c1", StreamEntryId.of(1, 0), 42L)));
    }

    @Test
    void shouldFailFastAfterRedisError() {
        when(hashOps.entries(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        SyncStateStoreException first = assertThrows(SyncStateStoreException.class, () -> store.get(1L, "dev-a", "c1"));
        assertEquals("get_failed", first.getMessage());

        SyncStateStoreException second = assertThrows(SyncStateStoreException.class,
                () -> store.put(new ClientSyncState("dev-a", 1L, "c1", StreamEntryId.of(1, 0), 42L)));
        assertEquals("redis_fail_fast", second.getMessage());
        verify(redis, never()).execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(),
                anyString(), anyString(), anyString(), anyString(), anyString(), anyString());
    }
}
