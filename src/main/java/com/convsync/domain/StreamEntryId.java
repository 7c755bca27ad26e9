package com.convsync.domain;

import java.util.Objects;

/**
 * 日志条目 id：由日志存储在 append 时分配，形如 {@code <ms>-<seq>}（与 Redis Stream entry id 一致）。
 *
 * <p>排序按 (ms, seq) 数值比较，与时间顺序一致；注意不能按字符串字典序比较（"10-0" 小于 "9-0"）。</p>
 * <p>哨兵值 {@code "0"} 表示“保留历史的起点”，等价于 {@code 0-0}。</p>
 */
public final class StreamEntryId implements Comparable<StreamEntryId> {

    public static final StreamEntryId BEGINNING = new StreamEntryId(0, 0);

    private final long ms;
    private final long seq;

    private StreamEntryId(long ms, long seq) {
        this.ms = ms;
        this.seq = seq;
    }

    public static StreamEntryId of(long ms, long seq) {
        if (ms < 0 || seq < 0) {
            throw new IllegalArgumentException("invalid_stream_entry_id");
        }
        if (ms == 0 && seq == 0) {
            return BEGINNING;
        }
        return new StreamEntryId(ms, seq);
    }

    /**
     * 解析 {@code <ms>-<seq>} 或 {@code <ms>}；空串/null 视为 {@link #BEGINNING}。
     */
    public static StreamEntryId parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return BEGINNING;
        }
        String s = raw.trim();
        int idx = s.indexOf('-');
        try {
            if (idx < 0) {
                return of(Long.parseLong(s), 0);
            }
            return of(Long.parseLong(s.substring(0, idx)), Long.parseLong(s.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid_stream_entry_id: " + raw, e);
        }
    }

    public long ms() {
        return ms;
    }

    public long seq() {
        return seq;
    }

    public boolean isBeginning() {
        return ms == 0 && seq == 0;
    }

    public boolean isAfter(StreamEntryId other) {
        return compareTo(other) > 0;
    }

    /**
     * 同一毫秒内的下一个 id（用于 XRANGE 的“严格大于”起点）。
     */
    public StreamEntryId next() {
        if (seq == Long.MAX_VALUE) {
            return of(ms + 1, 0);
        }
        return of(ms, seq + 1);
    }

    public static StreamEntryId max(StreamEntryId a, StreamEntryId b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(StreamEntryId o) {
        int c = Long.compare(ms, o.ms);
        return c != 0 ? c : Long.compare(seq, o.seq);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamEntryId other)) {
            return false;
        }
        return ms == other.ms && seq == other.seq;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ms, seq);
    }

    /**
     * 起点输出 "0"，其余输出 {@code <ms>-<seq>}。
     */
    @Override
    public String toString() {
        if (isBeginning()) {
            return "0";
        }
        return ms + "-" + seq;
    }
}
