package com.convsync.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 慢连接保护。
 *
 * <ul>
 *   <li>写缓冲水位：超过 high 水位 channel 变为不可写</li>
 *   <li>closeUnwritableAfterMs：持续不可写超过该时长即关闭连接（客户端重连后从日志补齐）；负数表示不关闭</li>
 *   <li>dropSignalsWhenUnwritable：不可写时丢弃瞬时帧（SIGNAL/PING）；日志事件帧永不丢弃</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "im.gateway.ws.backpressure")
public record WsBackpressureProperties(
        Boolean enabled,
        Integer writeBufferLowWaterMarkBytes,
        Integer writeBufferHighWaterMarkBytes,
        Long closeUnwritableAfterMs,
        Boolean dropSignalsWhenUnwritable
) {

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public int lowWaterMarkBytesEffective() {
        Integer v = writeBufferLowWaterMarkBytes;
        if (v == null || v <= 0) {
            return 256 * 1024;
        }
        return v;
    }

    public int highWaterMarkBytesEffective() {
        Integer v = writeBufferHighWaterMarkBytes;
        if (v == null || v <= 0) {
            return 1024 * 1024;
        }
        int low = lowWaterMarkBytesEffective();
        return Math.max(v, low + 1);
    }

    public long closeUnwritableAfterMsEffective() {
        Long v = closeUnwritableAfterMs;
        if (v == null) {
            return 5_000;
        }
        return v;
    }

    public boolean dropSignalsWhenUnwritableEffective() {
        return dropSignalsWhenUnwritable == null || dropSignalsWhenUnwritable;
    }
}
