package com.convsync.log;

import com.convsync.config.ConversationLogProperties;
import com.convsync.domain.BroadcastEvent;
import com.convsync.domain.StreamEntryId;
import com.convsync.gateway.broadcast.LocalBroadcastRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 多实例 fan-out：每个实例 tail 同一条指针流（XREAD BLOCK），按指针回查日志条目后在本实例广播。
 *
 * <p>起点是启动时指针流的最新 id（空流则从头），之后始终从上一批最后一条继续读，不会漏掉两次读之间的写入。</p>
 * <p>Redis 不可用时指数退避重试（200ms 起，最多 5s），不影响网关其他功能；期间的实时事件丢失由客户端重连补齐。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "im.sync.log", name = "fanout-mode", havingValue = "stream")
public class ConversationFanoutListener implements SmartLifecycle {

    private final StringRedisTemplate redis;
    private final ConversationLog conversationLog;
    private final LocalBroadcastRegistry registry;
    private final ConversationLogProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;
    private volatile String lastId;

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "conv-fanout-listener");
            t.setDaemon(true);
            return t;
        });
        executor.submit(this::loop);
        log.info("conversation fanout listener started: stream={}", props.fanoutStreamKeyEffective());
    }

    @Override
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        ExecutorService es = executor;
        if (es != null) {
            es.shutdownNow();
            try {
                es.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("conversation fanout listener stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 晚于其他组件启动，早于它们停止
        return Integer.MAX_VALUE;
    }

    private void loop() {
        int failures = 0;
        while (running.get()) {
            try {
                pollOnce();
                failures = 0;
            } catch (Exception e) {
                if (!running.get()) {
                    break;
                }
                failures++;
                long delay = backoffMs(failures);
                log.warn("conversation fanout read failed (attempt={}, retryInMs={}): {}", failures, delay, e.toString());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    /**
     * 读一批指针并广播；返回本批条数。
     */
    int pollOnce() {
        String key = props.fanoutStreamKeyEffective();
        if (lastId == null) {
            lastId = resolveStartId(key);
        }
        List<MapRecord<String, Object, Object>> records = redis.opsForStream().read(
                StreamReadOptions.empty()
                        .count(props.fanoutBatchSizeEffective())
                        .block(Duration.ofMillis(props.fanoutBlockMsEffective())),
                StreamOffset.create(key, ReadOffset.from(lastId))
        );
        if (records == null || records.isEmpty()) {
            return 0;
        }
        for (MapRecord<String, Object, Object> r : records) {
            deliver(r);
            lastId = r.getId().getValue();
        }
        return records.size();
    }

    private String resolveStartId(String key) {
        List<MapRecord<String, Object, Object>> latest =
                redis.opsForStream().reverseRange(key, Range.unbounded(), Limit.limit().count(1));
        if (latest == null || latest.isEmpty()) {
            return "0-0";
        }
        return latest.get(0).getId().getValue();
    }

    private void deliver(MapRecord<String, Object, Object> pointer) {
        Map<Object, Object> v = pointer.getValue();
        String conversationId = RedisStreamConversationLog.asString(v.get(RedisStreamConversationLog.FIELD_CONVERSATION_ID));
        String rawEntryId = RedisStreamConversationLog.asString(v.get(RedisStreamConversationLog.FIELD_ENTRY_ID));
        if (conversationId.isBlank() || rawEntryId.isBlank()) {
            log.debug("conversation fanout pointer malformed: id={}", pointer.getId());
            return;
        }
        if (registry.subscriberCount(conversationId) == 0) {
            return;
        }
        StreamEntryId entryId;
        try {
            entryId = StreamEntryId.parse(rawEntryId);
        } catch (IllegalArgumentException e) {
            log.debug("conversation fanout pointer has bad entry id: id={}, entryId={}", pointer.getId(), rawEntryId);
            return;
        }
        LogEntry entry = conversationLog.get(conversationId, entryId);
        if (entry == null) {
            // 已被裁剪：订阅者会在重连时从日志补齐（或走过期游标的重同步）
            return;
        }
        registry.publish(conversationId, BroadcastEvent.durable(conversationId, entry.id(), entry.payload(), entry.producedAt()));
    }

    static long backoffMs(int attempt) {
        if (attempt <= 0) {
            return 200;
        }
        long v = 200L * (1L << Math.min(6, attempt - 1));
        return Math.min(5000L, Math.max(200L, v));
    }
}
