package com.convsync.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 每个 WS 连接会话的参数。
 *
 * <ul>
 *   <li>subscriberQueueCapacity：实时订阅的有界队列容量；溢出即断开并要求客户端重连补齐</li>
 *   <li>catchUpPageSize：补齐阶段每次 readSince 的条数</li>
 *   <li>writerIdleSeconds：多久没写出就发一次心跳</li>
 *   <li>readerIdleSeconds：多久没收到任何数据就判定连接失效</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "im.gateway.ws.session")
public record WsSessionProperties(
        Integer subscriberQueueCapacity,
        Integer catchUpPageSize,
        Integer writerIdleSeconds,
        Integer readerIdleSeconds
) {

    public int subscriberQueueCapacityEffective() {
        Integer v = subscriberQueueCapacity;
        if (v == null || v <= 0) {
            return 1024;
        }
        return v;
    }

    public int catchUpPageSizeEffective() {
        Integer v = catchUpPageSize;
        if (v == null || v <= 0) {
            return 500;
        }
        return Math.min(v, 10_000);
    }

    public int writerIdleSecondsEffective() {
        Integer v = writerIdleSeconds;
        if (v == null || v <= 0) {
            return 5;
        }
        return v;
    }

    public int readerIdleSecondsEffective() {
        Integer v = readerIdleSeconds;
        if (v == null || v <= 0) {
            return 30;
        }
        return Math.max(v, writerIdleSecondsEffective() + 1);
    }
}
