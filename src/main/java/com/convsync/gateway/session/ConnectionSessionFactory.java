package com.convsync.gateway.session;

import com.convsync.config.SyncStateProperties;
import com.convsync.gateway.broadcast.LocalBroadcastRegistry;
import com.convsync.gateway.config.WsSessionProperties;
import com.convsync.gateway.ws.WsWriter;
import com.convsync.log.ConversationLog;
import com.convsync.sync.ClientSyncStateStore;
import io.netty.channel.Channel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;

@Component
public class ConnectionSessionFactory {

    private final ConversationLog conversationLog;
    private final ClientSyncStateStore syncStateStore;
    private final LocalBroadcastRegistry broadcastRegistry;
    private final WsWriter writer;
    private final Executor ioExecutor;
    private final WsSessionProperties sessionProps;
    private final SyncStateProperties syncProps;
    private final Clock clock;

    public ConnectionSessionFactory(ConversationLog conversationLog,
                                    ClientSyncStateStore syncStateStore,
                                    LocalBroadcastRegistry broadcastRegistry,
                                    WsWriter writer,
                                    @Qualifier("imSyncExecutor") Executor ioExecutor,
                                    WsSessionProperties sessionProps,
                                    SyncStateProperties syncProps,
                                    Clock clock) {
        this.conversationLog = conversationLog;
        this.syncStateStore = syncStateStore;
        this.broadcastRegistry = broadcastRegistry;
        this.writer = writer;
        this.ioExecutor = ioExecutor;
        this.sessionProps = sessionProps;
        this.syncProps = syncProps;
        this.clock = clock;
    }

    public ConnectionSession create(Channel channel, SessionIdentity identity) {
        return new ConnectionSession(
                channel,
                identity,
                conversationLog,
                syncStateStore,
                broadcastRegistry,
                writer,
                ioExecutor,
                sessionProps.catchUpPageSizeEffective(),
                syncProps.intervalMsEffective(),
                clock
        );
    }
}
