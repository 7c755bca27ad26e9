package com.convsync.gateway.ws;

import com.convsync.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * WS 心跳处理：
 * - 客户端 JSON PING -> 服务端 PONG
 * - 服务端 WRITER_IDLE -> 发出 WS ping 帧 + JSON PING；accessToken 已过期则提示后关闭
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WsPingHandler {

    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;

    public void handleClientPing(Channel ch) {
        WsEnvelope pong = WsEnvelope.of(WsEnvelope.PONG);
        pong.ts = Instant.now().toEpochMilli();
        wsWriter.writeDroppable(ch, pong);
    }

    public void onWriterIdle(Channel ch) {
        if (isExpired(ch)) {
            wsWriter.writeError(ch, "token_expired").addListener(f -> ch.close());
            return;
        }
        // WS 层 ping：触发客户端自动回 pong，配合 reader-idle 清理僵尸连接
        ch.writeAndFlush(new PingWebSocketFrame()).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("ws ping frame failed: cid={}, err={}", ch.attr(SessionRegistry.ATTR_CONN_ID).get(), String.valueOf(f.cause()));
            }
        });
        WsEnvelope ping = WsEnvelope.of(WsEnvelope.PING);
        ping.ts = Instant.now().toEpochMilli();
        wsWriter.writeDroppable(ch, ping);
    }

    private boolean isExpired(Channel ch) {
        Long expMs = sessionRegistry.getAccessExpMs(ch);
        return expMs != null && Instant.now().toEpochMilli() >= expMs;
    }
}
