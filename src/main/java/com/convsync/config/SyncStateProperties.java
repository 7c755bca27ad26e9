package com.convsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.sync.state")
public record SyncStateProperties(
        String keyPrefix,
        Integer ttlDays,
        Long intervalMs,
        Long redisFailFastMs
) {

    public String keyPrefixEffective() {
        String v = keyPrefix;
        if (v == null || v.isBlank()) {
            return "im:sync:cursor:";
        }
        return v;
    }

    public int ttlDaysEffective() {
        Integer v = ttlDays;
        if (v == null || v <= 0) {
            return 30;
        }
        return v;
    }

    /** Periodic Sync 间隔（毫秒），默认 5s。 */
    public long intervalMsEffective() {
        Long v = intervalMs;
        if (v == null || v <= 0) {
            return 5_000;
        }
        return Math.max(100, v);
    }

    /** Redis 出错后的快速失败窗口；0 表示不启用。 */
    public long redisFailFastMsEffective() {
        Long v = redisFailFastMs;
        if (v == null) {
            return 1_000;
        }
        return Math.max(0, v);
    }
}
