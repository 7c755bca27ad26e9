package com.convsync.gateway.session;

import com.convsync.domain.ClientSyncState;
import com.convsync.domain.StreamEntryId;
import com.convsync.sync.ClientSyncStateStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 每个连接一个的游标持久化定时任务。
 *
 * <ul>
 *   <li>tick 在连接的 event loop 上执行：读 {@link CursorCell}（O(1)），有变化才把 put 交给 IO 线程池</li>
 *   <li>同一时刻最多一个 put 在途；失败只打日志，下个 tick 重试，不影响连接</li>
 *   <li>游标没变化时也会按 {@link #TTL_REFRESH_MS} 周期 put 一次，长连接期间刷新 TTL</li>
 *   <li>关闭时先发最后一次 put，完成（成功或失败）后才取消定时，避免迟到的 tick 覆盖最终值</li>
 * </ul>
 *
 * <p>inFlight/lastPersisted 只在 scheduler 线程上读写。</p>
 */
@Slf4j
public final class PeriodicSyncTask {

    static final long TTL_REFRESH_MS = 60L * 60 * 1000;

    private final SessionIdentity identity;
    private final CursorCell cursor;
    private final ClientSyncStateStore store;
    private final Executor ioExecutor;
    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private final Clock clock;

    private volatile ScheduledFuture<?> future;
    private StreamEntryId lastPersisted;
    private long lastPutAtMs;
    private boolean inFlight;
    private boolean finishing;

    public PeriodicSyncTask(SessionIdentity identity,
                            CursorCell cursor,
                            ClientSyncStateStore store,
                            Executor ioExecutor,
                            ScheduledExecutorService scheduler,
                            long intervalMs,
                            Clock clock) {
        this.identity = identity;
        this.cursor = cursor;
        this.store = store;
        this.ioExecutor = ioExecutor;
        this.scheduler = scheduler;
        this.intervalMs = intervalMs;
        this.clock = clock;
    }

    public void start() {
        if (future != null || finishing) {
            return;
        }
        future = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    void tick() {
        if (finishing || inFlight) {
            return;
        }
        StreamEntryId current = cursor.get();
        long now = clock.millis();
        if (current.equals(lastPersisted) && now - lastPutAtMs < TTL_REFRESH_MS) {
            return;
        }
        inFlight = true;
        persist(current).whenComplete((ok, e) -> runOnScheduler(() -> {
            inFlight = false;
            if (Boolean.TRUE.equals(ok)) {
                lastPersisted = StreamEntryId.max(lastPersisted, current);
                lastPutAtMs = now;
            }
        }));
    }

    /**
     * 最后一次持久化，然后取消定时任务。返回的 future 不会异常完成。
     */
    public CompletableFuture<Boolean> finish() {
        if (finishing) {
            return CompletableFuture.completedFuture(false);
        }
        finishing = true;
        StreamEntryId last = cursor.get();
        CompletableFuture<Boolean> done = persist(last);
        done.whenComplete((ok, e) -> cancel());
        return done;
    }

    public boolean isCancelled() {
        return future == null ? finishing : future.isCancelled();
    }

    private void cancel() {
        ScheduledFuture<?> f = future;
        if (f != null) {
            f.cancel(false);
        }
    }

    private CompletableFuture<Boolean> persist(StreamEntryId id) {
        CompletableFuture<Boolean> out = new CompletableFuture<>();
        ClientSyncState state = new ClientSyncState(identity.clientId(), identity.userId(), identity.conversationId(), id, clock.millis());
        try {
            ioExecutor.execute(() -> {
                try {
                    store.put(state);
                    out.complete(true);
                } catch (Exception e) {
                    log.warn("sync state persist failed, retry next tick: userId={}, clientId={}, conversationId={}, cursor={}, err={}",
                            identity.userId(), identity.clientId(), identity.conversationId(), id, e.toString());
                    out.complete(false);
                }
            });
        } catch (Exception e) {
            log.warn("sync state persist rejected: userId={}, clientId={}, err={}", identity.userId(), identity.clientId(), e.toString());
            out.complete(false);
        }
        return out;
    }

    private void runOnScheduler(Runnable r) {
        try {
            scheduler.execute(r);
        } catch (Exception e) {
            log.debug("sync task callback dropped (scheduler shut down): {}", e.toString());
        }
    }
}
