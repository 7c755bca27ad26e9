package com.convsync.api.dto;

/**
 * @param duplicate true 表示命中幂等，本次没有产生新条目
 */
public record PublishEventResponse(
        String conversationId,
        String streamEntryId,
        boolean duplicate
) {
}
