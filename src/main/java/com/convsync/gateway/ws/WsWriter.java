package com.convsync.gateway.ws;

import com.convsync.gateway.config.WsBackpressureProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * WS 文本协议统一写出器：
 * - 统一序列化/错误回包
 * - 保证 ch.writeAndFlush 在对应 channel eventLoop 执行（同一连接上的写出顺序 = 调用顺序）
 * - 日志事件帧永不因不可写而丢弃；慢连接由 WsBackpressureHandler 关闭
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WsWriter {

    private final ObjectMapper objectMapper;
    private final WsBackpressureProperties backpressureProps;

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (ch.eventLoop().inEventLoop()) {
            return doWrite(ch, env);
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> doWrite(ch, env).addListener(f -> {
                if (f.isSuccess()) {
                    promise.setSuccess();
                } else {
                    promise.setFailure(f.cause());
                }
            }));
        } catch (Exception e) {
            promise.setFailure(e);
        }
        return promise;
    }

    /**
     * 可丢弃的帧（瞬时信号、心跳）：channel 不可写时直接失败，避免在慢端堆积。
     */
    public ChannelFuture writeDroppable(Channel ch, WsEnvelope env) {
        if (ch != null
                && backpressureProps != null
                && backpressureProps.enabledEffective()
                && backpressureProps.dropSignalsWhenUnwritableEffective()
                && !ch.isWritable()) {
            return ch.newFailedFuture(new IllegalStateException("ws backpressure: channel not writable"));
        }
        return write(ch, env);
    }

    public ChannelFuture writeError(Channel ch, String reason) {
        WsEnvelope err = WsEnvelope.of(WsEnvelope.ERROR);
        err.reason = reason;
        err.ts = Instant.now().toEpochMilli();
        return write(ch, err);
    }

    private ChannelFuture doWrite(Channel ch, WsEnvelope env) {
        try {
            String json = objectMapper.writeValueAsString(env);
            return ch.writeAndFlush(new TextWebSocketFrame(json));
        } catch (Exception e) {
            log.warn("ws serialize/write failed: type={}, err={}", env == null ? null : env.type, e.toString());
            return ch.newFailedFuture(e);
        }
    }
}
