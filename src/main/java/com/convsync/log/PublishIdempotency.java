package com.convsync.log;

import com.convsync.config.PublishIdempotencyProperties;
import com.convsync.domain.StreamEntryId;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Getter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 基于 Caffeine 的发布幂等：用 (userId, conversationId, clientMsgId) 作为 key。
 *
 * <p>生产方重试同一个 clientMsgId 时直接返回第一次分配的 StreamEntryId，避免日志里出现重复事件。
 * 仅本实例内有效；跨实例重试仍可能重复，下游按 StreamEntryId/clientMsgId 去重。</p>
 */
@Component
@EnableConfigurationProperties(PublishIdempotencyProperties.class)
public class PublishIdempotency {

    @Getter
    private final PublishIdempotencyProperties props;
    private final Cache<String, Claim> cache;

    /** 一次占位；streamEntryId 为 null 表示对应的 append 还在进行中。 */
    public static final class Claim {
        private volatile StreamEntryId streamEntryId;

        public StreamEntryId getStreamEntryId() {
            return streamEntryId;
        }

        public void setStreamEntryId(StreamEntryId streamEntryId) {
            this.streamEntryId = streamEntryId;
        }
    }

    public PublishIdempotency(PublishIdempotencyProperties props) {
        this.props = props;
        this.cache = Caffeine.newBuilder()
                .initialCapacity(Math.max(1, props.getInitialCapacity()))
                .maximumSize(Math.max(1, props.getMaximumSize()))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, props.getExpireAfterWriteSeconds())))
                .build();
    }

    public String key(long userId, String conversationId, String clientMsgId) {
        return userId + ":" + conversationId + ":" + clientMsgId;
    }

    /**
     * @return 已存在的占位；首次占位成功返回 null。未启用时总是返回 null。
     */
    public Claim putIfAbsent(String key, Claim claim) {
        if (!props.isEnabled()) {
            return null;
        }
        return cache.asMap().putIfAbsent(key, claim);
    }

    public Claim get(String key) {
        return cache.getIfPresent(key);
    }

    public void remove(String key) {
        cache.invalidate(key);
    }
}
