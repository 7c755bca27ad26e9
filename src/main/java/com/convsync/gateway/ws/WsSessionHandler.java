package com.convsync.gateway.ws;

import com.convsync.gateway.session.ConnectionSession;
import com.convsync.gateway.session.ConnectionSessionFactory;
import com.convsync.gateway.session.SessionIdentity;
import com.convsync.gateway.session.SessionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * 握手完成后的业务帧处理：创建并驱动 {@link ConnectionSession}，分发上行帧。
 *
 * <p>上行协议：PING -> PONG；TYPING -> 瞬时信号；其他类型/无法解析/二进制帧一律忽略，不断开连接。</p>
 */
@Slf4j
public class WsSessionHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final ConnectionSessionFactory sessionFactory;
    private final WsPingHandler pingHandler;

    public WsSessionHandler(ObjectMapper objectMapper,
                            SessionRegistry sessionRegistry,
                            ConnectionSessionFactory sessionFactory,
                            WsPingHandler pingHandler) {
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.sessionFactory = sessionFactory;
        this.pingHandler = pingHandler;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof WebSocketFrame && !(msg instanceof TextWebSocketFrame)) {
            log.debug("ws non-text frame ignored: cid={}, type={}", ctx.channel().attr(SessionRegistry.ATTR_CONN_ID).get(), msg.getClass().getSimpleName());
            ReferenceCountUtil.release(msg);
            return;
        }
        super.channelRead(ctx, msg);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        ConnectionSession session = sessionRegistry.session(ctx.channel());
        if (session == null) {
            return;
        }
        WsEnvelope msg;
        try {
            msg = objectMapper.readValue(frame.text(), WsEnvelope.class);
        } catch (Exception e) {
            log.debug("ws malformed frame ignored: userId={}, clientId={}, err={}",
                    session.identity().userId(), session.identity().clientId(), e.toString());
            return;
        }
        if (msg == null || msg.type == null) {
            log.debug("ws frame without type ignored: userId={}", session.identity().userId());
            return;
        }
        switch (msg.type) {
            case WsEnvelope.PING -> pingHandler.handleClientPing(ctx.channel());
            case WsEnvelope.TYPING -> session.onTyping(msg.payload);
            default -> log.debug("ws unknown frame type ignored: userId={}, type={}", session.identity().userId(), msg.type);
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            onHandshakeComplete(ctx);
            return;
        }
        if (evt instanceof IdleStateEvent e) {
            if (e.state() == IdleState.READER_IDLE) {
                // 一段时间没有收到任何数据（包括 pong）：断网/客户端异常退出，关闭后走正常收尾
                log.debug("ws reader idle, closing: cid={}", ctx.channel().attr(SessionRegistry.ATTR_CONN_ID).get());
                ctx.close();
            } else if (e.state() == IdleState.WRITER_IDLE && sessionRegistry.session(ctx.channel()) != null) {
                pingHandler.onWriterIdle(ctx.channel());
            }
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    private void onHandshakeComplete(ChannelHandlerContext ctx) {
        SessionIdentity identity = sessionRegistry.identity(ctx.channel());
        if (identity == null) {
            ctx.close();
            return;
        }
        ConnectionSession session = sessionFactory.create(ctx.channel(), identity);
        sessionRegistry.register(ctx.channel(), session);
        log.debug("ws session opened: cid={}, userId={}, clientId={}, conversationId={}, clientIdMinted={}",
                ctx.channel().attr(SessionRegistry.ATTR_CONN_ID).get(),
                identity.userId(), identity.clientId(), identity.conversationId(), identity.clientIdMinted());
        session.start();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ConnectionSession session = sessionRegistry.session(ctx.channel());
        if (session != null) {
            session.teardown();
            sessionRegistry.unregister(ctx.channel());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("ws channel error, closing: cid={}, err={}", ctx.channel().attr(SessionRegistry.ATTR_CONN_ID).get(), cause.toString());
        ctx.close();
    }
}
