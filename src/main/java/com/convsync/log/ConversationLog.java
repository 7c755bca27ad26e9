package com.convsync.log;

import com.convsync.domain.StreamEntryId;

import java.time.Duration;
import java.util.List;

/**
 * 持久、有序的会话事件日志（每个会话一条流）。
 *
 * <ul>
 *   <li>append：分配严格大于该会话所有已有 id 的新 id；失败抛 {@link ConversationLogException}，不会“部分成功”</li>
 *   <li>readSince：返回 id 严格大于 afterId 的条目，升序；空列表是正常结果</li>
 *   <li>超过保留期（默认 30 天）的条目不保证可读；游标过旧时由调用方决定“从最新处重新同步”</li>
 * </ul>
 */
public interface ConversationLog {

    default StreamEntryId append(String conversationId, String payload) {
        return appendEntry(conversationId, payload).id();
    }

    /**
     * 同 {@link #append}，返回写入的完整条目（含日志记录的 producedAt），实时广播用它保证与补齐读到的一致。
     */
    LogEntry appendEntry(String conversationId, String payload);

    default List<LogEntry> readSince(String conversationId, StreamEntryId afterId) {
        return readSince(conversationId, afterId, 0);
    }

    /**
     * @param limit 最多返回条数；{@code <= 0} 表示不限制
     */
    List<LogEntry> readSince(String conversationId, StreamEntryId afterId, int limit);

    /**
     * 读取单条（用于 fan-out 指针回查）；不存在（已被裁剪）返回 null。
     */
    LogEntry get(String conversationId, StreamEntryId id);

    /**
     * 当前保留的最新 id；会话为空返回 null。
     */
    StreamEntryId latestId(String conversationId);

    Duration retention();
}
