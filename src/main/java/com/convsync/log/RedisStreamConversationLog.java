package com.convsync.log;

import com.convsync.config.ConversationLogProperties;
import com.convsync.domain.StreamEntryId;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Redis Stream 的会话日志。
 *
 * <ul>
 *   <li>每个会话一条流：{@code <prefix><conversationId>}，字段 payload / producedAt</li>
 *   <li>stream fan-out 模式下，同一个 Lua 脚本里再往指针流 XADD 一条 (conversationId, entryId)，
 *   保证指针流顺序与 append 顺序一致</li>
 *   <li>保留期按时间裁剪（XTRIM MINID ~），每个会话每 N 次 append 在后台执行一次，不占用 append 路径</li>
 * </ul>
 */
@Slf4j
public class RedisStreamConversationLog implements ConversationLog {

    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_PRODUCED_AT = "producedAt";
    static final String FIELD_CONVERSATION_ID = "conversationId";
    static final String FIELD_ENTRY_ID = "entryId";

    private final StringRedisTemplate redis;
    private final ConversationLogProperties props;
    private final Executor trimExecutor;
    private final Clock clock;

    private final DefaultRedisScript<String> appendScript = buildAppendScript();

    /** 会话 -> 本实例 append 计数，只用于决定何时裁剪；淘汰只会让裁剪推迟。 */
    private final Cache<String, AtomicLong> appendCounters = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterAccess(Duration.ofHours(1))
            .build();
    private final AtomicLong fanoutAppends = new AtomicLong();

    public RedisStreamConversationLog(StringRedisTemplate redis,
                                      ConversationLogProperties props,
                                      Executor trimExecutor,
                                      Clock clock) {
        this.redis = redis;
        this.props = props;
        this.trimExecutor = trimExecutor;
        this.clock = clock;
    }

    @Override
    public LogEntry appendEntry(String conversationId, String payload) {
        requireConversation(conversationId);
        boolean fanout = props.streamFanout();
        String body = payload == null ? "" : payload;
        long producedAt = clock.millis();
        String raw;
        try {
            raw = redis.execute(
                    appendScript,
                    List.of(streamKey(conversationId), props.fanoutStreamKeyEffective()),
                    body,
                    String.valueOf(producedAt),
                    fanout ? "1" : "0",
                    conversationId
            );
        } catch (Exception e) {
            log.warn("conversation log append failed: conversationId={}, err={}", conversationId, e.toString());
            throw new ConversationLogException("append_failed", e);
        }
        if (raw == null || raw.isBlank()) {
            throw new ConversationLogException("append_returned_nil");
        }
        StreamEntryId id = StreamEntryId.parse(raw);
        maybeTrim(conversationId, fanout);
        return new LogEntry(id, body, producedAt);
    }

    @Override
    public List<LogEntry> readSince(String conversationId, StreamEntryId afterId, int limit) {
        requireConversation(conversationId);
        StreamEntryId after = afterId == null ? StreamEntryId.BEGINNING : afterId;
        // XRANGE 的起点包含自身，用 after.next() 表达“严格大于”
        Range<String> range = Range.rightUnbounded(Range.Bound.inclusive(after.next().toString()));
        List<MapRecord<String, Object, Object>> records;
        try {
            records = limit > 0
                    ? redis.opsForStream().range(streamKey(conversationId), range, Limit.limit().count(limit))
                    : redis.opsForStream().range(streamKey(conversationId), range);
        } catch (Exception e) {
            log.warn("conversation log read failed: conversationId={}, after={}, err={}", conversationId, after, e.toString());
            throw new ConversationLogException("read_failed", e);
        }
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<LogEntry> out = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> r : records) {
            out.add(toEntry(r));
        }
        return out;
    }

    @Override
    public LogEntry get(String conversationId, StreamEntryId id) {
        requireConversation(conversationId);
        if (id == null) {
            return null;
        }
        List<MapRecord<String, Object, Object>> records;
        try {
            records = redis.opsForStream().range(streamKey(conversationId), Range.closed(id.toString(), id.toString()));
        } catch (Exception e) {
            throw new ConversationLogException("get_failed", e);
        }
        if (records == null || records.isEmpty()) {
            return null;
        }
        return toEntry(records.get(0));
    }

    @Override
    public StreamEntryId latestId(String conversationId) {
        requireConversation(conversationId);
        List<MapRecord<String, Object, Object>> records;
        try {
            records = redis.opsForStream().reverseRange(streamKey(conversationId), Range.unbounded(), Limit.limit().count(1));
        } catch (Exception e) {
            throw new ConversationLogException("latest_failed", e);
        }
        if (records == null || records.isEmpty()) {
            return null;
        }
        return StreamEntryId.parse(records.get(0).getId().getValue());
    }

    @Override
    public Duration retention() {
        return Duration.ofDays(props.retentionDaysEffective());
    }

    String streamKey(String conversationId) {
        return props.streamKeyPrefixEffective() + conversationId;
    }

    private void maybeTrim(String conversationId, boolean fanout) {
        int every = props.trimEveryAppendsEffective();
        AtomicLong counter = appendCounters.get(conversationId, k -> new AtomicLong());
        if (counter.incrementAndGet() % every == 0) {
            long minMs = clock.millis() - retention().toMillis();
            submitTrim(streamKey(conversationId), minMs);
        }
        if (fanout && fanoutAppends.incrementAndGet() % every == 0) {
            long minMs = clock.millis() - Duration.ofHours(props.fanoutRetentionHoursEffective()).toMillis();
            submitTrim(props.fanoutStreamKeyEffective(), minMs);
        }
    }

    private void submitTrim(String key, long minMs) {
        if (minMs <= 0) {
            return;
        }
        try {
            trimExecutor.execute(() -> trimByMinId(key, minMs));
        } catch (RejectedExecutionException e) {
            log.debug("conversation log trim skipped (executor busy): key={}", key);
        }
    }

    void trimByMinId(String key, long minMs) {
        String minId = minMs + "-0";
        try {
            // XTRIM <key> MINID ~ <minId>：按时间裁剪，近似裁剪不会删掉比 minId 新的条目
            Object removed = redis.execute((RedisCallback<Object>) conn -> conn.execute("XTRIM",
                    key.getBytes(StandardCharsets.UTF_8),
                    "MINID".getBytes(StandardCharsets.UTF_8),
                    "~".getBytes(StandardCharsets.UTF_8),
                    minId.getBytes(StandardCharsets.UTF_8)));
            log.debug("conversation log trimmed: key={}, minId={}, removed={}", key, minId, removed);
        } catch (Exception e) {
            log.warn("conversation log trim failed: key={}, minId={}, err={}", key, minId, e.toString());
        }
    }

    private static LogEntry toEntry(MapRecord<String, Object, Object> r) {
        Map<Object, Object> v = r.getValue();
        return new LogEntry(
                StreamEntryId.parse(r.getId().getValue()),
                asString(v.get(FIELD_PAYLOAD)),
                asLong(v.get(FIELD_PRODUCED_AT))
        );
    }

    static String asString(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    static long asLong(Object o) {
        if (o == null) {
            return 0L;
        }
        if (o instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(o).trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static void requireConversation(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is blank");
        }
    }

    private static DefaultRedisScript<String> buildAppendScript() {
        DefaultRedisScript<String> s = new DefaultRedisScript<>();
        s.setResultType(String.class);
        s.setScriptText("""
                local id = redis.call('XADD', KEYS[1], '*',
                  'payload', ARGV[1],
                  'producedAt', ARGV[2]
                )
                if ARGV[3] == '1' then
                  redis.call('XADD', KEYS[2], '*',
                    'conversationId', ARGV[4],
                    'entryId', id
                  )
                end
                return id
                """);
        return s;
    }
}
