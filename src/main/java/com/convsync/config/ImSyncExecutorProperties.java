package com.convsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话 IO 线程池（游标读写、补齐阶段的日志读取、握手成员校验）。
 */
@ConfigurationProperties(prefix = "im.executors.sync")
public record ImSyncExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        Integer v = corePoolSize;
        if (v == null) {
            return 8;
        }
        return Math.max(1, v);
    }

    public int maxPoolSizeEffective() {
        Integer v = maxPoolSize;
        if (v == null) {
            return 32;
        }
        return Math.max(1, v);
    }

    public int queueCapacityEffective() {
        Integer v = queueCapacity;
        if (v == null) {
            return 10_000;
        }
        return Math.max(0, v);
    }
}
