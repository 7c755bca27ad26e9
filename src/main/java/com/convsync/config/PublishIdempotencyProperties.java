package com.convsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.sync.publish.idempotency")
public class PublishIdempotencyProperties {

    /** 是否启用发布幂等（按 clientMsgId 去重）。 */
    private boolean enabled = true;

    /** Caffeine 初始容量。 */
    private int initialCapacity = 1024;

    /** Caffeine 最大条目数。 */
    private long maximumSize = 100_000;

    /** 写入后过期（秒）：生产方的重试窗口。 */
    private long expireAfterWriteSeconds = 600;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public void setInitialCapacity(int initialCapacity) {
        this.initialCapacity = initialCapacity;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public long getExpireAfterWriteSeconds() {
        return expireAfterWriteSeconds;
    }

    public void setExpireAfterWriteSeconds(long expireAfterWriteSeconds) {
        this.expireAfterWriteSeconds = expireAfterWriteSeconds;
    }
}
