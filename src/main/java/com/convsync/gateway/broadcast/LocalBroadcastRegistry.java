package com.convsync.gateway.broadcast;

import com.convsync.domain.BroadcastEvent;
import com.convsync.gateway.config.WsSessionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本实例内的实时广播：conversationId -> 订阅集合。
 *
 * <p>只保证 best-effort、每个订阅至多一次、仅限本实例；持久路径永远是日志。</p>
 * <p>订阅/退订都通过 {@link ConcurrentHashMap#compute} 原子完成，最后一个订阅退出时移除该会话条目。</p>
 */
@Slf4j
@Component
public class LocalBroadcastRegistry {

    private final ConcurrentHashMap<String, Set<LiveSubscription>> subscribers = new ConcurrentHashMap<>();
    private final int queueCapacity;

    public LocalBroadcastRegistry(WsSessionProperties props) {
        this.queueCapacity = props == null ? 1024 : props.subscriberQueueCapacityEffective();
    }

    public LiveSubscription subscribe(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is blank");
        }
        LiveSubscription sub = new LiveSubscription(this, conversationId, UUID.randomUUID().toString(), queueCapacity);
        subscribers.compute(conversationId, (k, set) -> {
            Set<LiveSubscription> s = set == null ? ConcurrentHashMap.newKeySet() : set;
            s.add(sub);
            return s;
        });
        return sub;
    }

    /**
     * 广播给该会话在本实例上的所有订阅；瞬时信号会跳过 originToken 对应的订阅。
     *
     * @return 成功入队的订阅数
     */
    public int publish(String conversationId, BroadcastEvent event) {
        if (conversationId == null || event == null) {
            return 0;
        }
        Set<LiveSubscription> set = subscribers.get(conversationId);
        if (set == null || set.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (LiveSubscription sub : set) {
            if (event.originToken() != null && event.originToken().equals(sub.token())) {
                continue;
            }
            if (sub.offer(event)) {
                delivered++;
            } else if (sub.isOverflowed()) {
                log.debug("broadcast subscriber overflowed: conversationId={}, token={}", conversationId, sub.token());
            }
        }
        return delivered;
    }

    void unsubscribe(LiveSubscription sub) {
        subscribers.computeIfPresent(sub.conversationId(), (k, set) -> {
            set.remove(sub);
            return set.isEmpty() ? null : set;
        });
    }

    public int subscriberCount(String conversationId) {
        Set<LiveSubscription> set = subscribers.get(conversationId);
        return set == null ? 0 : set.size();
    }

    public int conversationCount() {
        return subscribers.size();
    }
}
