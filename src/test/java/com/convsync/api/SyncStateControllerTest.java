package com.convsync.api;

import com.convsync.MutableClock;
import com.convsync.api.dto.SyncStateResponse;
import com.convsync.auth.web.AuthContext;
import com.convsync.common.api.Result;
import com.convsync.domain.AccessDeniedException;
import com.convsync.domain.ClientSyncState;
import com.convsync.domain.StreamEntryId;
import com.convsync.sync.InMemoryClientSyncStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class SyncStateControllerTest {

    private final MutableClock clock = new MutableClock(1_700_000_000_000L);
    private final InMemoryClientSyncStateStore store = new InMemoryClientSyncStateStore(clock, Duration.ofDays(30));
    private final SyncStateController controller =
            new SyncStateController(store, (userId, conversationId) -> !conversationId.startsWith("private"));

    @AfterEach
    void clear() {
        AuthContext.clear();
    }

    @Test
    void syncState_ShouldReturnOwnCursor() {
        store.put(new ClientSyncState("dev-a", 7L, "c1", StreamEntryId.of(5, 1), clock.millis()));
        store.put(new ClientSyncState("dev-a", 8L, "c1", StreamEntryId.of(9, 0), clock.millis()));
        AuthContext.setUserId(7L);

        Result<SyncStateResponse> r = controller.syncState("c1", "dev-a");

        assertTrue(r.ok());
        assertEquals("5-1", r.data().lastMessageId());
        assertEquals(7L, r.data().userId());
        assertEquals(clock.millis(), r.data().lastSyncAt());
    }

    @Test
    void syncState_ShouldReturnEmptyDataForUnknownDevice() {
        AuthContext.setUserId(7L);

        Result<SyncStateResponse> r = controller.syncState("c1", "dev-new");

        assertTrue(r.ok());
        assertNull(r.data());
    }

    @Test
    void syncState_ShouldValidateInputAndAccess() {
        AuthContext.setUserId(7L);

        assertThatThrownBy(() -> controller.syncState("c1", "bad client"))
                .hasMessage("invalid_client_id");
        assertThatThrownBy(() -> controller.syncState("private-1", "dev-a"))
                .isInstanceOf(AccessDeniedException.class);
    }
}
