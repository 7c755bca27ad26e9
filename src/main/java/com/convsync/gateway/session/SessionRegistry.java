package com.convsync.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本实例的连接登记：握手时把身份绑定到 channel 属性，会话建立后登记 connId -> ConnectionSession。
 *
 * <p>只在本机内存里维护；停机时用它逐个关闭会话，让每个会话做最后一次游标持久化。</p>
 */
@Component
public class SessionRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("uid");
    public static final AttributeKey<Long> ATTR_ACCESS_EXP_MS = AttributeKey.valueOf("aexp");
    public static final AttributeKey<String> ATTR_CONN_ID = AttributeKey.valueOf("cid");
    public static final AttributeKey<SessionIdentity> ATTR_IDENTITY = AttributeKey.valueOf("im:ws:identity");
    public static final AttributeKey<ConnectionSession> ATTR_SESSION = AttributeKey.valueOf("im:ws:session");

    private final ConcurrentHashMap<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

    public void bind(Channel ch, SessionIdentity identity, Long accessExpMs) {
        ch.attr(ATTR_USER_ID).set(identity.userId());
        ch.attr(ATTR_ACCESS_EXP_MS).set(accessExpMs);
        ch.attr(ATTR_CONN_ID).set(ch.id().asShortText());
        ch.attr(ATTR_IDENTITY).set(identity);
    }

    public boolean isAuthed(Channel ch) {
        return ch.attr(ATTR_IDENTITY).get() != null;
    }

    public SessionIdentity identity(Channel ch) {
        return ch.attr(ATTR_IDENTITY).get();
    }

    public Long getAccessExpMs(Channel ch) {
        return ch.attr(ATTR_ACCESS_EXP_MS).get();
    }

    public void register(Channel ch, ConnectionSession session) {
        ch.attr(ATTR_SESSION).set(session);
        sessions.put(ch.id().asShortText(), session);
    }

    public ConnectionSession session(Channel ch) {
        return ch.attr(ATTR_SESSION).get();
    }

    public void unregister(Channel ch) {
        ConnectionSession s = ch.attr(ATTR_SESSION).getAndSet(null);
        if (s != null) {
            sessions.remove(ch.id().asShortText(), s);
        }
    }

    public Collection<ConnectionSession> all() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
