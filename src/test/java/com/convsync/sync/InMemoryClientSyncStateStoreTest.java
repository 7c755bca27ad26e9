package com.convsync.sync;

import com.convsync.MutableClock;
import com.convsync.domain.ClientSyncState;
import com.convsync.domain.StreamEntryId;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryClientSyncStateStoreTest {

    private static final long NOW = 1_700_000_000_000L;

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryClientSyncStateStore store = new InMemoryClientSyncStateStore(clock, Duration.ofDays(30));

    @Test
    void get_ShouldReturnNullForNeverSeenDevice() {
        assertNull(store.get(1L, "dev-a", "c1"));
    }

    @Test
    void put_ShouldOnlyMoveCursorForward() {
        assertTrue(store.put(state("dev-a", StreamEntryId.of(100, 5), NOW)));
        assertFalse(store.put(state("dev-a", StreamEntryId.of(100, 4), NOW + 1)));
        assertFalse(store.put(state("dev-a", StreamEntryId.of(100, 5), NOW + 2)));

        ClientSyncState got = store.get(1L, "dev-a", "c1");
        assertEquals(StreamEntryId.of(100, 5), got.lastMessageId());
        assertEquals(NOW + 2, got.lastSyncAt());

        assertTrue(store.put(state("dev-a", StreamEntryId.of(101, 0), NOW + 3)));
        assertEquals(StreamEntryId.of(101, 0), store.get(1L, "dev-a", "c1").lastMessageId());
    }

    @Test
    void put_ShouldKeepDevicesIndependent() {
        store.put(state("dev-a", StreamEntryId.of(200, 0), NOW));
        store.put(state("dev-b", StreamEntryId.of(100, 0), NOW));

        assertEquals(StreamEntryId.of(200, 0), store.get(1L, "dev-a", "c1").lastMessageId());
        assertEquals(StreamEntryId.of(100, 0), store.get(1L, "dev-b", "c1").lastMessageId());
        assertNull(store.get(2L, "dev-a", "c1"));
        assertNull(store.get(1L, "dev-a", "c2"));
    }

    @Test
    void get_ShouldForgetStateAfterTtlWithoutRefresh() {
        store.put(state("dev-a", StreamEntryId.of(100, 0), NOW));

        clock.advance(Duration.ofDays(29).toMillis());
        assertNotNull(store.get(1L, "dev-a", "c1"));

        clock.advance(Duration.ofDays(2).toMillis());
        assertNull(store.get(1L, "dev-a", "c1"));
    }

    @Test
    void put_ShouldRefreshTtlEvenWhenCursorUnchanged() {
        store.put(state("dev-a", StreamEntryId.of(100, 0), NOW));
        clock.advance(Duration.ofDays(20).toMillis());
        store.put(state("dev-a", StreamEntryId.of(100, 0), clock.millis()));
        clock.advance(Duration.ofDays(20).toMillis());

        assertNotNull(store.get(1L, "dev-a", "c1"));
    }

    @Test
    void put_ShouldAcceptAnyCursorAfterExpiry() {
        store.put(state("dev-a", StreamEntryId.of(500, 0), NOW));
        clock.advance(Duration.ofDays(31).toMillis());

        assertTrue(store.put(state("dev-a", StreamEntryId.of(100, 0), clock.millis())));
        assertEquals(StreamEntryId.of(100, 0), store.get(1L, "dev-a", "c1").lastMessageId());
    }

    @Test
    void expiredCursorsShouldBeEvictedWithoutBeingReadAgain() {
        for (int i = 0; i < 10_000; i++) {
            store.put(state("minted-" + i, StreamEntryId.of(100, 0), NOW));
        }
        clock.advance(Duration.ofDays(31).toMillis());
        for (int i = 0; i < 10; i++) {
            store.put(state("fresh-" + i, StreamEntryId.of(200, 0), clock.millis()));
        }

        assertEquals(10, store.size());
        assertNotNull(store.get(1L, "fresh-0", "c1"));
    }

    private static ClientSyncState state(String clientId, StreamEntryId cursor, long syncAt) {
        return new ClientSyncState(clientId, 1L, "c1", cursor, syncAt);
    }
}
