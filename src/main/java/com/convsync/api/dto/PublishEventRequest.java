package com.convsync.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param payload     不透明事件正文，原样写入日志
 * @param clientMsgId 可选；生产方重试时带同一个值，服务端返回第一次分配的 id
 */
public record PublishEventRequest(
        @NotBlank(message = "missing_payload") String payload,
        @Size(max = 64, message = "client_msg_id_too_long") String clientMsgId
) {
}
