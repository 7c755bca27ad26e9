package com.convsync.gateway.session;

import com.convsync.domain.StreamEntryId;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 连接级“最后一次成功下发的 id”。
 *
 * <p>会话在写出成功后推进，Periodic Sync Task 读取后持久化；只前进不后退。</p>
 */
public final class CursorCell {

    private final ReentrantLock lock = new ReentrantLock();
    private StreamEntryId value;

    public CursorCell(StreamEntryId initial) {
        this.value = initial == null ? StreamEntryId.BEGINNING : initial;
    }

    public StreamEntryId get() {
        lock.lock();
        try {
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return 是否前进；不大于当前值时忽略
     */
    public boolean advance(StreamEntryId id) {
        if (id == null) {
            return false;
        }
        lock.lock();
        try {
            if (!id.isAfter(value)) {
                return false;
            }
            value = id;
            return true;
        } finally {
            lock.unlock();
        }
    }
}
