package com.convsync.config;

import com.convsync.domain.ConversationAccessPolicy;
import com.convsync.log.ConversationLog;
import com.convsync.log.InMemoryConversationLog;
import com.convsync.log.RedisStreamConversationLog;
import com.convsync.sync.ClientSyncStateStore;
import com.convsync.sync.InMemoryClientSyncStateStore;
import com.convsync.sync.RedisClientSyncStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * 存储选择：im.sync.storage.mode=redis（默认）| local。
 *
 * <p>local 只用于单机/开发：日志与游标都在内存里，重启即丢失，也不支持 stream fan-out。</p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ConversationLogProperties.class, SyncStateProperties.class})
public class SyncStorageConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "im.sync.storage", name = "mode", havingValue = "redis", matchIfMissing = true)
    public ConversationLog redisConversationLog(StringRedisTemplate redis,
                                                ConversationLogProperties props,
                                                @Qualifier("imSyncExecutor") Executor executor,
                                                Clock clock) {
        if (props.fanoutKeyInsideConversationPrefix()) {
            throw new IllegalStateException("im.sync.log.fanout-stream-key must not start with im.sync.log.stream-key-prefix: "
                    + props.fanoutStreamKeyEffective());
        }
        log.info("conversation log: redis stream, prefix={}, retentionDays={}, fanout={}",
                props.streamKeyPrefixEffective(), props.retentionDaysEffective(), props.fanoutModeEffective());
        return new RedisStreamConversationLog(redis, props, executor, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "im.sync.storage", name = "mode", havingValue = "local")
    public ConversationLog inMemoryConversationLog(ConversationLogProperties props, Clock clock) {
        if (props.streamFanout()) {
            throw new IllegalStateException("im.sync.log.fanout-mode=stream requires im.sync.storage.mode=redis");
        }
        log.warn("conversation log: in-memory (local mode), events are lost on restart");
        return new InMemoryConversationLog(clock, Duration.ofDays(props.retentionDaysEffective()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "im.sync.storage", name = "mode", havingValue = "redis", matchIfMissing = true)
    public ClientSyncStateStore redisClientSyncStateStore(StringRedisTemplate redis, SyncStateProperties props) {
        return new RedisClientSyncStateStore(redis, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "im.sync.storage", name = "mode", havingValue = "local")
    public ClientSyncStateStore inMemoryClientSyncStateStore(SyncStateProperties props, Clock clock) {
        return new InMemoryClientSyncStateStore(clock, Duration.ofDays(props.ttlDaysEffective()));
    }

    /**
     * 默认放行所有会话；接入真实的会话/成员服务时提供自己的 {@link ConversationAccessPolicy} Bean 即可覆盖。
     */
    @Bean
    @ConditionalOnMissingBean
    public ConversationAccessPolicy conversationAccessPolicy() {
        return (userId, conversationId) -> true;
    }
}
