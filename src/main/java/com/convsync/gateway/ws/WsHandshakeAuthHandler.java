package com.convsync.gateway.ws;

import com.convsync.auth.service.JwtService;
import com.convsync.domain.ConversationAccessPolicy;
import com.convsync.domain.Identifiers;
import com.convsync.gateway.session.SessionIdentity;
import com.convsync.gateway.session.SessionRegistry;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import io.netty.util.ReferenceCountUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * WebSocket 握手阶段（HTTP Upgrade）鉴权与身份解析：
 * <ul>
 *   <li>从 Authorization: Bearer <token> 或 query 参数 token/accessToken 里取 accessToken，校验并解析 userId/exp（失败 401）</li>
 *   <li>query 参数 conversationId 必填（缺失/非法 400）</li>
 *   <li>query 参数 clientId 为设备稳定标识；没带则服务端生成一个，通过 SYNC_START 下发给客户端保存</li>
 *   <li>会话成员校验在 IO 线程池执行（可能阻塞），不通过 403</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final String wsPath;
    private final JwtService jwtService;
    private final SessionRegistry sessionRegistry;
    private final ConversationAccessPolicy accessPolicy;
    private final Executor ioExecutor;

    public WsHandshakeAuthHandler(String wsPath,
                                  JwtService jwtService,
                                  SessionRegistry sessionRegistry,
                                  ConversationAccessPolicy accessPolicy,
                                  Executor ioExecutor) {
        this.wsPath = wsPath;
        this.jwtService = jwtService;
        this.sessionRegistry = sessionRegistry;
        this.accessPolicy = accessPolicy;
        this.ioExecutor = ioExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        // 只处理 WS 握手对应的 upgrade 请求；其他 HTTP 请求放行（由后续 handler 决定）。
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        // 如果已经鉴权过（例如重复握手/异常场景），直接放行。
        if (sessionRegistry.isAuthed(ctx.channel())) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "missing_access_token");
            return;
        }

        long userId;
        Long expMs;
        try {
            Jws<Claims> jws = jwtService.parseAccessToken(token);
            Claims claims = jws.getPayload();
            userId = jwtService.getUserId(claims);
            expMs = claims.getExpiration() == null ? null : claims.getExpiration().getTime();
        } catch (Exception e) {
            writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, "invalid_access_token");
            return;
        }

        Map<String, List<String>> params = new QueryStringDecoder(uri).parameters();
        String conversationId = first(params, "conversationId");
        if (!Identifiers.isValid(conversationId)) {
            writeAndClose(ctx, HttpResponseStatus.BAD_REQUEST, "invalid_conversation_id");
            return;
        }
        String clientId = first(params, "clientId");
        boolean minted = false;
        if (clientId == null || clientId.isBlank()) {
            clientId = UUID.randomUUID().toString();
            minted = true;
        } else if (!Identifiers.isValid(clientId)) {
            writeAndClose(ctx, HttpResponseStatus.BAD_REQUEST, "invalid_client_id");
            return;
        }
        SessionIdentity identity = new SessionIdentity(userId, clientId, conversationId, minted);

        // 成员校验是异步的：保留请求直到结果回到 event loop
        req.retain();
        CompletableFuture<Boolean> check;
        try {
            check = CompletableFuture.supplyAsync(() -> accessPolicy.canAccess(userId, conversationId), ioExecutor);
        } catch (Exception e) {
            check = CompletableFuture.failedFuture(e);
        }
        check.whenComplete((allowed, err) -> ctx.executor().execute(() -> {
            if (err != null) {
                log.warn("ws handshake access check failed: userId={}, conversationId={}, err={}", userId, conversationId, err.toString());
                ReferenceCountUtil.release(req);
                writeAndClose(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE, "access_check_failed");
                return;
            }
            if (!Boolean.TRUE.equals(allowed)) {
                ReferenceCountUtil.release(req);
                writeAndClose(ctx, HttpResponseStatus.FORBIDDEN, "forbidden");
                return;
            }
            sessionRegistry.bind(ctx.channel(), identity, expMs);
            ctx.fireChannelRead(req);
        }));
    }

    private String extractAccessToken(FullHttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring("Bearer ".length()).trim();
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        Map<String, List<String>> params = decoder.parameters();

        String fromToken = first(params, "token");
        if (fromToken != null && !fromToken.isBlank()) {
            return fromToken;
        }
        String fromAccessToken = first(params, "accessToken");
        if (fromAccessToken != null && !fromAccessToken.isBlank()) {
            return fromAccessToken;
        }
        return null;
    }

    private String first(Map<String, List<String>> params, String key) {
        List<String> list = params.get(key);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    private void writeAndClose(ChannelHandlerContext ctx, HttpResponseStatus status, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(bytes)
        );
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp);
        ctx.close();
    }
}
