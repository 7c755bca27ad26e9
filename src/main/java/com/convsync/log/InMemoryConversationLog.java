package com.convsync.log;

import com.convsync.domain.StreamEntryId;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机内存版日志（im.sync.storage.mode=local）：开发/单机/测试使用，进程重启即丢失。
 *
 * <p>id 分配规则与 Redis Stream 一致：ms 取 max(当前时间, 上一条 ms)，同一毫秒内 seq 递增。</p>
 */
public class InMemoryConversationLog implements ConversationLog {

    private final Clock clock;
    private final Duration retention;
    private final Map<String, Stream> streams = new ConcurrentHashMap<>();

    public InMemoryConversationLog(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention;
    }

    @Override
    public LogEntry appendEntry(String conversationId, String payload) {
        requireConversation(conversationId);
        Stream s = streams.computeIfAbsent(conversationId, k -> new Stream());
        long now = clock.millis();
        synchronized (s) {
            long ms = Math.max(now, s.lastId.ms());
            long seq = ms == s.lastId.ms() ? s.lastId.seq() + 1 : 0;
            StreamEntryId id = StreamEntryId.of(ms, seq);
            LogEntry entry = new LogEntry(id, payload == null ? "" : payload, now);
            s.entries.put(id, entry);
            s.lastId = id;
            trimExpired(s, now);
            return entry;
        }
    }

    @Override
    public List<LogEntry> readSince(String conversationId, StreamEntryId afterId, int limit) {
        requireConversation(conversationId);
        Stream s = streams.get(conversationId);
        if (s == null) {
            return List.of();
        }
        StreamEntryId after = afterId == null ? StreamEntryId.BEGINNING : afterId;
        synchronized (s) {
            trimExpired(s, clock.millis());
            List<LogEntry> out = new ArrayList<>();
            for (LogEntry e : s.entries.tailMap(after, false).values()) {
                if (limit > 0 && out.size() >= limit) {
                    break;
                }
                out.add(e);
            }
            return out;
        }
    }

    @Override
    public LogEntry get(String conversationId, StreamEntryId id) {
        Stream s = streams.get(conversationId);
        if (s == null || id == null) {
            return null;
        }
        synchronized (s) {
            return s.entries.get(id);
        }
    }

    @Override
    public StreamEntryId latestId(String conversationId) {
        Stream s = streams.get(conversationId);
        if (s == null) {
            return null;
        }
        synchronized (s) {
            return s.entries.isEmpty() ? null : s.entries.lastKey();
        }
    }

    @Override
    public Duration retention() {
        return retention;
    }

    private void trimExpired(Stream s, long nowMs) {
        long minMs = nowMs - retention.toMillis();
        while (!s.entries.isEmpty() && s.entries.firstKey().ms() < minMs) {
            s.entries.pollFirstEntry();
        }
    }

    private static void requireConversation(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is blank");
        }
    }

    private static final class Stream {
        private final NavigableMap<StreamEntryId, LogEntry> entries = new TreeMap<>();
        private StreamEntryId lastId = StreamEntryId.BEGINNING;
    }
}
