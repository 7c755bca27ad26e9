package com.convsync.gateway.session;

import com.convsync.domain.BroadcastEvent;
import com.convsync.domain.ClientSyncState;
import com.convsync.domain.StreamEntryId;
import com.convsync.gateway.broadcast.LiveSubscription;
import com.convsync.gateway.broadcast.LocalBroadcastRegistry;
import com.convsync.gateway.ws.WsEnvelope;
import com.convsync.gateway.ws.WsWriter;
import com.convsync.log.ConversationLog;
import com.convsync.log.LogEntry;
import com.convsync.sync.ClientSyncStateStore;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * 一个 WS 连接的投递状态机：CONNECTING → CATCHING_UP → LIVE → CLOSING → CLOSED。
 *
 * <p>线程模型：所有状态只在 channel 的 event loop 上读写；存储调用走 IO 线程池，结果再切回 event loop。</p>
 *
 * <p>补齐与实时的衔接：</p>
 * <ol>
 *   <li>先订阅实时广播（事件先进入有界队列，不下发）</li>
 *   <li>按页 readSince(游标) 下发，每条写出成功后推进 {@link CursorCell}</li>
 *   <li>补齐结束后进入 LIVE 并排空队列；id 不大于已下发位置的事件是衔接处的重复，直接跳过</li>
 * </ol>
 * <p>先订阅后读日志，所以 read 与 subscribe 之间写入的事件要么被补齐读到、要么在队列里，不会丢。</p>
 */
@Slf4j
public final class ConnectionSession {

    private final Channel channel;
    private final SessionIdentity identity;
    private final ConversationLog conversationLog;
    private final ClientSyncStateStore syncStateStore;
    private final LocalBroadcastRegistry broadcastRegistry;
    private final WsWriter writer;
    private final Executor ioExecutor;
    private final int pageSize;
    private final long syncIntervalMs;
    private final Clock clock;

    private final CursorCell cursor = new CursorCell(StreamEntryId.BEGINNING);
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final CompletableFuture<Boolean> finalFlush = new CompletableFuture<>();

    private volatile SessionState state = SessionState.CONNECTING;
    private LiveSubscription subscription;
    private PeriodicSyncTask syncTask;
    /** 已交给写出的最大 id（不代表写出成功）；用于排序与去重。 */
    private StreamEntryId lastSentId = StreamEntryId.BEGINNING;
    private boolean closeRequested;
    /** 一旦有写出失败，后续写出即使成功也不再推进游标，保证游标之前没有缺口。 */
    private boolean sendBroken;

    public ConnectionSession(Channel channel,
                             SessionIdentity identity,
                             ConversationLog conversationLog,
                             ClientSyncStateStore syncStateStore,
                             LocalBroadcastRegistry broadcastRegistry,
                             WsWriter writer,
                             Executor ioExecutor,
                             int pageSize,
                             long syncIntervalMs,
                             Clock clock) {
        this.channel = channel;
        this.identity = identity;
        this.conversationLog = conversationLog;
        this.syncStateStore = syncStateStore;
        this.broadcastRegistry = broadcastRegistry;
        this.writer = writer;
        this.ioExecutor = ioExecutor;
        this.pageSize = Math.max(1, pageSize);
        this.syncIntervalMs = syncIntervalMs;
        this.clock = clock;
    }

    public SessionIdentity identity() {
        return identity;
    }

    public SessionState state() {
        return state;
    }

    public StreamEntryId cursor() {
        return cursor.get();
    }

    /**
     * 关闭时最后一次游标持久化的结果（true=成功）；未加载游标就关闭的连接不做持久化，结果为 false。
     */
    public CompletableFuture<Boolean> finalFlush() {
        return finalFlush;
    }

    public void start() {
        if (!channel.eventLoop().inEventLoop()) {
            runOnLoop(this::start);
            return;
        }
        if (state != SessionState.CONNECTING || subscription != null) {
            return;
        }
        subscription = broadcastRegistry.subscribe(identity.conversationId());
        subscription.onAvailable(this::scheduleDrain);

        if (identity.clientIdMinted()) {
            onSyncStateLoaded(null, null);
            return;
        }
        callIo(() -> syncStateStore.get(identity.userId(), identity.clientId(), identity.conversationId()))
                .whenComplete((loaded, err) -> runOnLoop(() -> onSyncStateLoaded(loaded, err)));
    }

    private void onSyncStateLoaded(ClientSyncState loaded, Throwable err) {
        if (state != SessionState.CONNECTING) {
            return;
        }
        StreamEntryId initial = StreamEntryId.BEGINNING;
        if (err != null) {
            // 读不到游标只会导致重复，不会丢：从头补齐
            log.warn("sync state load failed, catch up from beginning: userId={}, clientId={}, conversationId={}, err={}",
                    identity.userId(), identity.clientId(), identity.conversationId(), err.toString());
        } else if (loaded != null && loaded.lastMessageId() != null) {
            initial = loaded.lastMessageId();
        }
        cursor.advance(initial);
        lastSentId = initial;

        syncTask = new PeriodicSyncTask(identity, cursor, syncStateStore, ioExecutor, channel.eventLoop(), syncIntervalMs, clock);
        syncTask.start();

        WsEnvelope hello = WsEnvelope.of(WsEnvelope.SYNC_START);
        hello.conversationId = identity.conversationId();
        hello.clientId = identity.clientId();
        hello.streamEntryId = initial.toString();
        hello.ts = clock.millis();
        writer.write(channel, hello);

        if (isStale(initial)) {
            resyncFromLatest(initial);
            return;
        }
        state = SessionState.CATCHING_UP;
        readPage(initial);
    }

    /** 游标早于日志保留期：中间的条目可能已被裁剪，不能假装补齐。 */
    private boolean isStale(StreamEntryId c) {
        if (c.isBeginning()) {
            return false;
        }
        return c.ms() < clock.millis() - conversationLog.retention().toMillis();
    }

    private void resyncFromLatest(StreamEntryId stale) {
        state = SessionState.CATCHING_UP;
        callIo(() -> conversationLog.latestId(identity.conversationId()))
                .whenComplete((latest, err) -> runOnLoop(() -> {
                    if (state != SessionState.CATCHING_UP) {
                        return;
                    }
                    if (err != null) {
                        failClosed("catch_up_failed", err);
                        return;
                    }
                    if (latest != null) {
                        cursor.advance(latest);
                        lastSentId = StreamEntryId.max(lastSentId, latest);
                    }
                    log.info("ws session cursor beyond retention, resync from latest: userId={}, clientId={}, conversationId={}, stale={}, latest={}",
                            identity.userId(), identity.clientId(), identity.conversationId(), stale, latest);
                    WsEnvelope resync = WsEnvelope.of(WsEnvelope.RESYNC);
                    resync.conversationId = identity.conversationId();
                    resync.streamEntryId = lastSentId.toString();
                    resync.ts = clock.millis();
                    writer.write(channel, resync);
                    goLive();
                }));
    }

    private void readPage(StreamEntryId after) {
        callIo(() -> conversationLog.readSince(identity.conversationId(), after, pageSize))
                .whenComplete((entries, err) -> runOnLoop(() -> onPage(entries, err)));
    }

    private void onPage(List<LogEntry> entries, Throwable err) {
        if (state != SessionState.CATCHING_UP) {
            return;
        }
        if (err != null) {
            // 补齐失败不能带着缺口进入 LIVE：直接失败关闭，客户端重试握手
            failClosed("catch_up_failed", err);
            return;
        }
        if (entries == null || entries.isEmpty()) {
            finishCatchUp();
            return;
        }
        ChannelFuture last = null;
        for (LogEntry e : entries) {
            if (!e.id().isAfter(lastSentId)) {
                continue;
            }
            last = sendEvent(e.id(), e.payload(), e.producedAt());
        }
        if (entries.size() < pageSize) {
            finishCatchUp();
            return;
        }
        StreamEntryId next = entries.get(entries.size() - 1).id();
        if (last == null) {
            readPage(next);
            return;
        }
        // 上一页写出后再读下一页：补齐速度受客户端消费速度约束
        last.addListener(f -> {
            if (f.isSuccess()) {
                runOnLoop(() -> readPage(next));
            }
        });
    }

    private void finishCatchUp() {
        WsEnvelope done = WsEnvelope.of(WsEnvelope.CATCH_UP_DONE);
        done.conversationId = identity.conversationId();
        done.streamEntryId = lastSentId.toString();
        done.ts = clock.millis();
        writer.write(channel, done);
        goLive();
    }

    private void goLive() {
        state = SessionState.LIVE;
        log.debug("ws session live: userId={}, clientId={}, conversationId={}, cursor={}",
                identity.userId(), identity.clientId(), identity.conversationId(), lastSentId);
        drain();
    }

    private void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            runOnLoop(this::drain);
        }
    }

    private void drain() {
        drainScheduled.set(false);
        if (state != SessionState.LIVE || subscription == null) {
            return;
        }
        BroadcastEvent e;
        while ((e = subscription.poll()) != null) {
            if (e.isEphemeral()) {
                sendSignal(e);
                continue;
            }
            if (!e.streamEntryId().isAfter(lastSentId)) {
                continue;
            }
            sendEvent(e.streamEntryId(), e.payload(), e.producedAt());
        }
        if (subscription.isOverflowed()) {
            log.warn("ws session live queue overflowed, force resync: userId={}, clientId={}, conversationId={}, cursor={}",
                    identity.userId(), identity.clientId(), identity.conversationId(), cursor.get());
            closeWithError("resync_required");
        }
    }

    private ChannelFuture sendEvent(StreamEntryId id, String payload, long producedAt) {
        lastSentId = id;
        WsEnvelope env = WsEnvelope.of(WsEnvelope.EVENT);
        env.conversationId = identity.conversationId();
        env.streamEntryId = id.toString();
        env.payload = payload;
        env.ts = producedAt;
        ChannelFuture f = writer.write(channel, env);
        f.addListener(done -> {
            if (done.isSuccess()) {
                if (!sendBroken) {
                    cursor.advance(id);
                }
            } else {
                onSendFailed(id, done.cause());
            }
        });
        return f;
    }

    private void sendSignal(BroadcastEvent e) {
        WsEnvelope env = WsEnvelope.of(WsEnvelope.SIGNAL);
        env.conversationId = identity.conversationId();
        env.from = e.originUserId();
        env.payload = e.payload();
        env.ts = e.producedAt();
        writer.writeDroppable(channel, env);
    }

    private void onSendFailed(StreamEntryId id, Throwable cause) {
        sendBroken = true;
        if (state == SessionState.CLOSING || state == SessionState.CLOSED) {
            return;
        }
        log.debug("ws send failed, closing: userId={}, clientId={}, id={}, err={}",
                identity.userId(), identity.clientId(), id, cause == null ? null : cause.toString());
        channel.close();
    }

    /**
     * 上行的正在输入信号：只在本实例广播给同一会话的其他连接，不入日志、不影响游标。
     */
    public void onTyping(String payload) {
        if (state != SessionState.LIVE || subscription == null) {
            return;
        }
        broadcastRegistry.publish(identity.conversationId(),
                BroadcastEvent.signal(identity.conversationId(), payload, clock.millis(), subscription.token(), identity.userId()));
    }

    public void closeWithError(String reason) {
        if (!channel.eventLoop().inEventLoop()) {
            runOnLoop(() -> closeWithError(reason));
            return;
        }
        if (closeRequested || state == SessionState.CLOSING || state == SessionState.CLOSED) {
            return;
        }
        closeRequested = true;
        if (!channel.isActive()) {
            channel.close();
            return;
        }
        writer.writeError(channel, reason).addListener(f -> channel.close());
    }

    private void failClosed(String reason, Throwable err) {
        log.warn("ws session failed closed: userId={}, clientId={}, conversationId={}, reason={}, err={}",
                identity.userId(), identity.clientId(), identity.conversationId(), reason, err == null ? null : err.toString());
        closeWithError(reason);
    }

    /**
     * 连接已断开（channelInactive）：最后一次持久化 → 持久化完成后取消定时任务 → 释放订阅。
     * 不等待持久化结果。
     */
    public void teardown() {
        if (!channel.eventLoop().inEventLoop()) {
            runOnLoop(this::teardown);
            return;
        }
        if (state == SessionState.CLOSING || state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSING;
        if (syncTask != null) {
            syncTask.finish().whenComplete((ok, e) -> finalFlush.complete(Boolean.TRUE.equals(ok)));
        } else {
            finalFlush.complete(false);
        }
        LiveSubscription sub = subscription;
        if (sub != null) {
            sub.close();
        }
        state = SessionState.CLOSED;
        log.debug("ws session closed: userId={}, clientId={}, conversationId={}, cursor={}",
                identity.userId(), identity.clientId(), identity.conversationId(), cursor.get());
    }

    private <T> CompletableFuture<T> callIo(Supplier<T> supplier) {
        try {
            return CompletableFuture.supplyAsync(supplier, ioExecutor);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void runOnLoop(Runnable r) {
        if (channel.eventLoop().inEventLoop()) {
            r.run();
            return;
        }
        try {
            channel.eventLoop().execute(r);
        } catch (Exception e) {
            log.debug("ws session task dropped (event loop shut down): {}", e.toString());
        }
    }
}
