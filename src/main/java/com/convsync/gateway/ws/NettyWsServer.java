package com.convsync.gateway.ws;

import com.convsync.auth.service.JwtService;
import com.convsync.domain.ConversationAccessPolicy;
import com.convsync.gateway.config.GatewayProperties;
import com.convsync.gateway.config.WsBackpressureProperties;
import com.convsync.gateway.config.WsSessionProperties;
import com.convsync.gateway.session.ConnectionSession;
import com.convsync.gateway.session.ConnectionSessionFactory;
import com.convsync.gateway.session.SessionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class NettyWsServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(NettyWsServer.class);

    /**
     * 停机时等待各会话最后一次游标持久化的上限。
     */
    private static final long SHUTDOWN_FLUSH_WAIT_MS = 3_000;

    private final GatewayProperties props;
    private final WsBackpressureProperties backpressureProps;
    private final WsSessionProperties sessionProps;
    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;
    private final ConnectionSessionFactory sessionFactory;
    private final WsPingHandler pingHandler;
    private final ConversationAccessPolicy accessPolicy;
    private final Executor imSyncExecutor;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         WsBackpressureProperties backpressureProps,
                         WsSessionProperties sessionProps,
                         ObjectMapper objectMapper,
                         JwtService jwtService,
                         SessionRegistry sessionRegistry,
                         ConnectionSessionFactory sessionFactory,
                         WsPingHandler pingHandler,
                         ConversationAccessPolicy accessPolicy,
                         @Qualifier("imSyncExecutor") Executor imSyncExecutor) {
        this.props = props;
        this.backpressureProps = backpressureProps;
        this.sessionProps = sessionProps;
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
        this.sessionFactory = sessionFactory;
        this.pingHandler = pingHandler;
        this.accessPolicy = accessPolicy;
        this.imSyncExecutor = imSyncExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{}", props.hostEffective(), props.portEffective(), path);

        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(
                        backpressureProps.lowWaterMarkBytesEffective(),
                        backpressureProps.highWaterMarkBytesEffective()))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        // 1) HTTP 编解码 + 聚合：握手阶段是 HTTP
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(65536));

                        // 2) 慢连接看门狗：持续不可写就断开，客户端重连后从日志补齐
                        p.addLast(new WsBackpressureHandler(backpressureProps));

                        // 3) 空闲检测：reader idle 判定失效；writer idle 触发心跳
                        p.addLast(new IdleStateHandler(
                                sessionProps.readerIdleSecondsEffective(),
                                sessionProps.writerIdleSecondsEffective(),
                                0));

                        // 4) 握手鉴权 + 会话身份解析（userId/clientId/conversationId）
                        p.addLast(new WsHandshakeAuthHandler(path, jwtService, sessionRegistry, accessPolicy, imSyncExecutor));

                        // 5) WebSocket 协议处理（握手、协议层 ping/pong、close）
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        // 6) 会话：补齐 -> 实时推送，游标周期持久化
                        p.addLast(new WsSessionHandler(objectMapper, sessionRegistry, sessionFactory, pingHandler));
                    }
                });

        try {
            serverChannel = b.bind(props.hostEffective(), props.portEffective()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.hostEffective(), props.portEffective(), path, e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        closeSessions();
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    private void closeSessions() {
        Collection<ConnectionSession> sessions = sessionRegistry.all();
        if (sessions.isEmpty()) {
            return;
        }
        CompletableFuture<?>[] flushes = new CompletableFuture<?>[sessions.size()];
        int i = 0;
        for (ConnectionSession s : sessions) {
            s.closeWithError("server_shutdown");
            flushes[i++] = s.finalFlush();
        }
        try {
            CompletableFuture.allOf(flushes).get(SHUTDOWN_FLUSH_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("ws shutdown: final cursor flush timed out: sessions={}, waitMs={}", sessions.size(), SHUTDOWN_FLUSH_WAIT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("ws shutdown: final cursor flush failed: sessions={}, err={}", sessions.size(), e.toString());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return Integer.MIN_VALUE; // 尽早启动
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
