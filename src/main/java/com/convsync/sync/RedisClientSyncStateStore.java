package com.convsync.sync;

import com.convsync.config.SyncStateProperties;
import com.convsync.domain.ClientSyncState;
import com.convsync.domain.StreamEntryId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis 版游标存储：每个 (userId, clientId, conversationId) 一个 Hash。
 *
 * <p>put 用 Lua 做“只前进”的比较写入，并总是刷新 TTL；比较按 (ms, seq) 数值进行。</p>
 * <p>Redis 出错后进入短暂的 fail-fast 窗口，避免每个连接的每次 tick 都去撞一个已经挂掉的 Redis。</p>
 */
@Slf4j
public class RedisClientSyncStateStore implements ClientSyncStateStore {

    static final String FIELD_CLIENT_ID = "clientId";
    static final String FIELD_USER_ID = "userId";
    static final String FIELD_CONVERSATION_ID = "conversationId";
    static final String FIELD_LAST_MESSAGE_ID = "lastMessageId";
    static final String FIELD_LAST_SYNC_AT = "lastSyncAt";

    private final StringRedisTemplate redis;
    private final SyncStateProperties props;
    private final AtomicLong redisUnavailableUntilMs = new AtomicLong(0);

    private final DefaultRedisScript<Long> monotonicPutScript = buildMonotonicPutScript();

    public RedisClientSyncStateStore(StringRedisTemplate redis, SyncStateProperties props) {
        this.redis = redis;
        this.props = props;
    }

    @Override
    public ClientSyncState get(long userId, String clientId, String conversationId) {
        failFastIfDown();
        Map<Object, Object> raw;
        try {
            raw = redis.opsForHash().entries(key(userId, clientId, conversationId));
        } catch (Exception e) {
            markRedisDown();
            throw new SyncStateStoreException("get_failed", e);
        }
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        Object last = raw.get(FIELD_LAST_MESSAGE_ID);
        StreamEntryId cursor;
        try {
            cursor = StreamEntryId.parse(last == null ? null : String.valueOf(last));
        } catch (IllegalArgumentException e) {
            log.warn("sync state has corrupt cursor, treat as never seen: userId={}, clientId={}, conversationId={}, raw={}",
                    userId, clientId, conversationId, last);
            return null;
        }
        return new ClientSyncState(clientId, userId, conversationId, cursor, asLong(raw.get(FIELD_LAST_SYNC_AT)));
    }

    @Override
    public boolean put(ClientSyncState state) {
        if (state == null || state.lastMessageId() == null) {
            throw new IllegalArgumentException("state is null");
        }
        failFastIfDown();
        long ttlSeconds = Duration.ofDays(props.ttlDaysEffective()).toSeconds();
        Long applied;
        try {
            applied = redis.execute(
                    monotonicPutScript,
                    List.of(key(state.userId(), state.clientId(), state.conversationId())),
                    state.lastMessageId().toString(),
                    state.clientId(),
                    String.valueOf(state.userId()),
                    state.conversationId(),
                    String.valueOf(state.lastSyncAt()),
                    String.valueOf(ttlSeconds)
            );
        } catch (Exception e) {
            markRedisDown();
            throw new SyncStateStoreException("put_failed", e);
        }
        return applied != null && applied == 1L;
    }

    String key(long userId, String clientId, String conversationId) {
        return props.keyPrefixEffective() + userId + ":" + clientId + ":" + conversationId;
    }

    private void failFastIfDown() {
        if (System.currentTimeMillis() < redisUnavailableUntilMs.get()) {
            throw new SyncStateStoreException("redis_fail_fast");
        }
    }

    private void markRedisDown() {
        long window = props.redisFailFastMsEffective();
        if (window <= 0) {
            return;
        }
        long until = System.currentTimeMillis() + window;
        while (true) {
            long prev = redisUnavailableUntilMs.get();
            if (prev >= until) {
                return;
            }
            if (redisUnavailableUntilMs.compareAndSet(prev, until)) {
                return;
            }
        }
    }

    private static long asLong(Object o) {
        if (o == null) {
            return 0L;
        }
        try {
            return Long.parseLong(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static DefaultRedisScript<Long> buildMonotonicPutScript() {
        DefaultRedisScript<Long> s = new DefaultRedisScript<>();
        s.setResultType(Long.class);
        s.setScriptText("""
                local function parse(id)
                  local ms, seq = string.match(id, '^(%d+)-(%d+)$')
                  if ms then
                    return tonumber(ms), tonumber(seq)
                  end
                  return tonumber(id) or 0, 0
                end

                local applied = 0
                local cur = redis.call('HGET', KEYS[1], 'lastMessageId')
                if not cur then
                  applied = 1
                else
                  local cms, cseq = parse(cur)
                  local nms, nseq = parse(ARGV[1])
                  if nms > cms or (nms == cms and nseq > cseq) then
                    applied = 1
                  end
                end

                if applied == 1 then
                  redis.call('HSET', KEYS[1], 'lastMessageId', ARGV[1])
                end
                redis.call('HSET', KEYS[1],
                  'clientId', ARGV[2],
                  'userId', ARGV[3],
                  'conversationId', ARGV[4],
                  'lastSyncAt', ARGV[5]
                )
                redis.call('EXPIRE', KEYS[1], ARGV[6])
                return applied
                """);
        return s;
    }
}
