package com.convsync.gateway.session;

import com.convsync.MutableClock;
import com.convsync.domain.ClientSyncState;
import com.convsync.domain.StreamEntryId;
import com.convsync.sync.ClientSyncStateStore;
import com.convsync.sync.SyncStateStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class PeriodicSyncTaskTest {

    private static final long NOW = 1_700_000_000_000L;

    private final SessionIdentity identity = new SessionIdentity(1L, "dev-a", "c1", false);
    private final MutableClock clock = new MutableClock(NOW);
    private final CursorCell cursor = new CursorCell(StreamEntryId.BEGINNING);

    private ClientSyncStateStore store;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> scheduled;

    @BeforeEach
    void setUp() {
        store = mock(ClientSyncStateStore.class);
        scheduler = mock(ScheduledExecutorService.class);
        scheduled = mock(ScheduledFuture.class);
        doAnswer(inv -> {
            ((Runnable) inv.getArgument(0)).run();
            return null;
        }).when(scheduler).execute(any(Runnable.class));
        doReturn(scheduled).when(scheduler).scheduleAtFixedRate(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
    }

    @Test
    void start_ShouldScheduleAtConfiguredInterval() {
        PeriodicSyncTask task = newTask();
        task.start();
        task.start();

        verify(scheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), eq(5000L), eq(5000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void tick_ShouldPersistOnlyWhenCursorChanged() {
        PeriodicSyncTask task = newTask();
        cursor.advance(StreamEntryId.of(100, 0));

        task.tick();
        task.tick();
        verify(store, times(1)).put(any());

        cursor.advance(StreamEntryId.of(100, 1));
        task.tick();

        ArgumentCaptor<ClientSyncState> captor = ArgumentCaptor.forClass(ClientSyncState.class);
        verify(store, times(2)).put(captor.capture());
        ClientSyncState last = captor.getValue();
        assertEquals(StreamEntryId.of(100, 1), last.lastMessageId());
        assertEquals("dev-a", last.clientId());
        assertEquals(1L, last.userId());
        assertEquals("c1", last.conversationId());
    }

    @Test
    void tick_ShouldRefreshTtlPeriodicallyWithoutNewEvents() {
        PeriodicSyncTask task = newTask();
        task.tick();
        verify(store, times(1)).put(any());

        clock.advance(PeriodicSyncTask.TTL_REFRESH_MS + 1);
        task.tick();
        verify(store, times(2)).put(any());
    }

    @Test
    void tick_ShouldRetryAfterStoreFailure() {
        PeriodicSyncTask task = newTask();
        cursor.advance(StreamEntryId.of(100, 0));
        when(store.put(any())).thenThrow(new SyncStateStoreException("put_failed")).thenReturn(true);

        task.tick();
        task.tick();

        verify(store, times(2)).put(any());
        task.tick();
        verify(store, times(2)).put(any());
    }

    @Test
    void finish_ShouldPersistFinalCursorThenCancel() throws Exception {
        PeriodicSyncTask task = newTask();
        task.start();
        cursor.advance(StreamEntryId.of(200, 3));

        CompletableFuture<Boolean> done = task.finish();

        assertTrue(done.get(1, TimeUnit.SECONDS));
        ArgumentCaptor<ClientSyncState> captor = ArgumentCaptor.forClass(ClientSyncState.class);
        verify(store).put(captor.capture());
        assertEquals(StreamEntryId.of(200, 3), captor.getValue().lastMessageId());
        verify(scheduled).cancel(false);

        task.tick();
        verify(store, times(1)).put(any());
        assertFalse(task.finish().get(1, TimeUnit.SECONDS));
    }

    @Test
    void finish_ShouldCompleteFalseWithoutThrowingWhenStoreFails() throws Exception {
        PeriodicSyncTask task = newTask();
        task.start();
        when(store.put(any())).thenThrow(new SyncStateStoreException("put_failed"));

        assertFalse(task.finish().get(1, TimeUnit.SECONDS));
        verify(scheduled).cancel(false);
    }

    @Test
    void finish_ShouldCancelOnlyAfterFinalPutCompletes() {
        CompletableFuture<Runnable> pendingIo = new CompletableFuture<>();
        PeriodicSyncTask task = new PeriodicSyncTask(identity, cursor, store, pendingIo::complete, scheduler, 5000, clock);
        task.start();

        CompletableFuture<Boolean> done = task.finish();
        assertFalse(done.isDone());
        verify(scheduled, never()).cancel(anyBoolean());

        pendingIo.join().run();
        assertTrue(done.isDone());
        verify(scheduled).cancel(false);
    }

    private PeriodicSyncTask newTask() {
        return new PeriodicSyncTask(identity, cursor, store, Runnable::run, scheduler, 5000, clock);
    }
}
