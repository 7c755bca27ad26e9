package com.convsync.gateway.session;

/**
 * 握手阶段确定的连接身份。
 *
 * @param clientIdMinted clientId 是否由服务端生成（客户端没带）；此时不可能续传，游标从 "0" 开始
 */
public record SessionIdentity(
        long userId,
        String clientId,
        String conversationId,
        boolean clientIdMinted
) {
}
