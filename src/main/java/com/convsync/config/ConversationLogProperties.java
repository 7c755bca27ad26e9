package com.convsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Locale;

/**
 * 会话日志配置。
 *
 * <p>fanoutMode：</p>
 * <ul>
 *   <li>local：append 成功后直接在本实例广播（单实例/开发）</li>
 *   <li>stream：append 同时写 fan-out 指针流，每个实例各自 tail 指针流再本地广播（多实例）</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "im.sync.log")
public record ConversationLogProperties(
        String streamKeyPrefix,
        Integer retentionDays,
        Integer trimEveryAppends,
        String fanoutMode,
        String fanoutStreamKey,
        Integer fanoutRetentionHours,
        Long fanoutBlockMs,
        Integer fanoutBatchSize
) {

    public String streamKeyPrefixEffective() {
        String v = streamKeyPrefix;
        if (v == null || v.isBlank()) {
            return "im:stream:conv:";
        }
        return v;
    }

    public int retentionDaysEffective() {
        Integer v = retentionDays;
        if (v == null || v <= 0) {
            return 30;
        }
        return v;
    }

    public int trimEveryAppendsEffective() {
        Integer v = trimEveryAppends;
        if (v == null || v <= 0) {
            return 100;
        }
        return v;
    }

    public String fanoutModeEffective() {
        String v = fanoutMode;
        if (v == null || v.isBlank()) {
            return "local";
        }
        return v.trim().toLowerCase(Locale.ROOT);
    }

    public boolean streamFanout() {
        return "stream".equals(fanoutModeEffective());
    }

    public String fanoutStreamKeyEffective() {
        String v = fanoutStreamKey;
        if (v == null || v.isBlank()) {
            return "im:stream:fanout";
        }
        return v;
    }

    /**
     * 指针流 key 落在会话流前缀之下时，会与某个合法 conversationId 的日志流撞 key。
     */
    public boolean fanoutKeyInsideConversationPrefix() {
        return fanoutStreamKeyEffective().startsWith(streamKeyPrefixEffective());
    }

    public int fanoutRetentionHoursEffective() {
        Integer v = fanoutRetentionHours;
        if (v == null || v <= 0) {
            return 24;
        }
        return v;
    }

    public long fanoutBlockMsEffective() {
        Long v = fanoutBlockMs;
        if (v == null || v <= 0) {
            return 5_000;
        }
        return Math.min(v, 60_000);
    }

    public int fanoutBatchSizeEffective() {
        Integer v = fanoutBatchSize;
        if (v == null || v <= 0) {
            return 100;
        }
        return Math.min(v, 1000);
    }
}
