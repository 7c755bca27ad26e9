package com.convsync.sync;

import com.convsync.domain.ClientSyncState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 本机内存版游标存储（im.sync.storage.mode=local）。
 *
 * <p>Caffeine expireAfterWrite 实现 TTL，每次 put 都重新计时；时间来自注入的 Clock。</p>
 */
public class InMemoryClientSyncStateStore implements ClientSyncStateStore {

    private static final int MAX_LOCAL_CURSORS = 1_000_000;

    private final Cache<String, ClientSyncState> states;

    public InMemoryClientSyncStateStore(Clock clock, Duration ttl) {
        this.states = Caffeine.newBuilder()
                .maximumSize(MAX_LOCAL_CURSORS)
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
    }

    @Override
    public ClientSyncState get(long userId, String clientId, String conversationId) {
        return states.getIfPresent(key(userId, clientId, conversationId));
    }

    @Override
    public boolean put(ClientSyncState state) {
        if (state == null || state.lastMessageId() == null) {
            throw new IllegalArgumentException("state is null");
        }
        AtomicBoolean applied = new AtomicBoolean(false);
        // 过期条目在 compute 里视为不存在
        states.asMap().compute(key(state.userId(), state.clientId(), state.conversationId()), (k, cur) -> {
            if (cur == null || state.lastMessageId().isAfter(cur.lastMessageId())) {
                applied.set(true);
                return state;
            }
            return state.withCursor(cur.lastMessageId(), state.lastSyncAt());
        });
        return applied.get();
    }

    long size() {
        states.cleanUp();
        return states.estimatedSize();
    }

    private static String key(long userId, String clientId, String conversationId) {
        return userId + ":" + clientId + ":" + conversationId;
    }
}
