package com.convsync.gateway.ws;

import com.convsync.gateway.config.WsBackpressureProperties;
import com.convsync.gateway.session.SessionIdentity;
import com.convsync.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 慢连接看门狗：channel 持续不可写超过 closeUnwritableAfterMs 就关闭。
 *
 * <p>关闭后走正常的会话收尾（最后一次游标持久化），客户端重连后从日志补齐，不会丢事件。</p>
 */
@Slf4j
public final class WsBackpressureHandler extends ChannelInboundHandlerAdapter {

    private static final AttributeKey<Long> ATTR_UNWRITABLE_SINCE_MS =
            AttributeKey.valueOf("im:ws:bp:unwritable_since_ms");
    private static final AttributeKey<ScheduledFuture<?>> ATTR_UNWRITABLE_CLOSE_FUTURE =
            AttributeKey.valueOf("im:ws:bp:unwritable_close_future");

    private final WsBackpressureProperties props;

    public WsBackpressureHandler(WsBackpressureProperties props) {
        this.props = props;
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) {
        Channel ch = ctx.channel();
        if (props == null || !props.enabledEffective()) {
            ctx.fireChannelWritabilityChanged();
            return;
        }

        if (ch.isWritable()) {
            clearUnwritableState(ch);
        } else {
            if (ch.attr(ATTR_UNWRITABLE_SINCE_MS).get() == null) {
                ch.attr(ATTR_UNWRITABLE_SINCE_MS).set(System.currentTimeMillis());
            }
            scheduleCloseIfNeeded(ch);
        }
        ctx.fireChannelWritabilityChanged();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        clearUnwritableState(ctx.channel());
        super.channelInactive(ctx);
    }

    private void clearUnwritableState(Channel ch) {
        ch.attr(ATTR_UNWRITABLE_SINCE_MS).set(null);
        ScheduledFuture<?> f = ch.attr(ATTR_UNWRITABLE_CLOSE_FUTURE).getAndSet(null);
        if (f != null) {
            f.cancel(false);
        }
    }

    private void scheduleCloseIfNeeded(Channel ch) {
        long closeAfterMs = props.closeUnwritableAfterMsEffective();
        if (closeAfterMs < 0 || ch.attr(ATTR_UNWRITABLE_CLOSE_FUTURE).get() != null) {
            return;
        }

        ScheduledFuture<?> future = ch.eventLoop().schedule(() -> {
            ch.attr(ATTR_UNWRITABLE_CLOSE_FUTURE).set(null);
            if (!ch.isActive()) {
                return;
            }
            if (ch.isWritable()) {
                clearUnwritableState(ch);
                return;
            }
            Long since = ch.attr(ATTR_UNWRITABLE_SINCE_MS).get();
            long durMs = since == null ? -1 : (System.currentTimeMillis() - since);
            SessionIdentity identity = ch.attr(SessionRegistry.ATTR_IDENTITY).get();

            log.warn("ws backpressure: closing slow consumer channel: cid={}, userId={}, clientId={}, durMs={}, bytesBeforeWritable={}",
                    ch.attr(SessionRegistry.ATTR_CONN_ID).get(),
                    identity == null ? null : identity.userId(),
                    identity == null ? null : identity.clientId(),
                    durMs, ch.bytesBeforeWritable());
            ch.close();
        }, closeAfterMs, TimeUnit.MILLISECONDS);

        ch.attr(ATTR_UNWRITABLE_CLOSE_FUTURE).set(future);
    }
}
