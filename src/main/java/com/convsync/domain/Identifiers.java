package com.convsync.domain;

import java.util.regex.Pattern;

/**
 * conversationId / clientId 的格式约束：1~128 位字母、数字或 {@code _ . : -}。
 * 它们会拼进 Redis key，必须在入口处校验。
 */
public final class Identifiers {

    private static final Pattern ID_PATTERN = Pattern.compile("^[A-Za-z0-9_.:\\-]{1,128}$");

    private Identifiers() {
    }

    public static boolean isValid(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    public static String requireConversationId(String conversationId) {
        if (!isValid(conversationId)) {
            throw new IllegalArgumentException("invalid_conversation_id");
        }
        return conversationId;
    }

    public static String requireClientId(String clientId) {
        if (!isValid(clientId)) {
            throw new IllegalArgumentException("invalid_client_id");
        }
        return clientId;
    }
}
