package com.convsync.gateway.broadcast;

import com.convsync.domain.BroadcastEvent;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个会话在某个会话（conversation）上的实时订阅句柄。
 *
 * <p>有界队列：发布方 offer，会话在自己的 event loop 上 poll。队列满时订阅进入 overflowed 状态，
 * 之后不再接收任何事件，会话据此断开连接，客户端重连后从日志补齐。</p>
 */
public final class LiveSubscription implements AutoCloseable {

    private final LocalBroadcastRegistry registry;
    private final String conversationId;
    private final String token;
    private final BlockingQueue<BroadcastEvent> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean overflowed;
    private volatile Runnable onAvailable;

    LiveSubscription(LocalBroadcastRegistry registry, String conversationId, String token, int capacity) {
        this.registry = registry;
        this.conversationId = conversationId;
        this.token = token;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public String conversationId() {
        return conversationId;
    }

    /** 订阅标识，瞬时信号用它排除发起方。 */
    public String token() {
        return token;
    }

    /**
     * 注册“有新事件/溢出”回调；回调在发布方线程上执行，实现应只做调度（例如提交到 event loop）。
     */
    public void onAvailable(Runnable callback) {
        this.onAvailable = callback;
        if (callback != null && (!queue.isEmpty() || overflowed)) {
            callback.run();
        }
    }

    boolean offer(BroadcastEvent event) {
        if (closed.get() || overflowed) {
            return false;
        }
        boolean ok = queue.offer(event);
        if (!ok) {
            overflowed = true;
            queue.clear();
        }
        Runnable cb = onAvailable;
        if (cb != null) {
            cb.run();
        }
        return ok;
    }

    public BroadcastEvent poll() {
        return queue.poll();
    }

    public boolean isOverflowed() {
        return overflowed;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int pending() {
        return queue.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        onAvailable = null;
        queue.clear();
        registry.unsubscribe(this);
    }
}
