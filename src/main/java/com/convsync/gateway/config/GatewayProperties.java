package com.convsync.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WS 网关监听地址。
 *
 * <p>path 同时用于握手鉴权匹配与 WebSocketServerProtocolHandler（按前缀匹配，允许带 query）。</p>
 */
@ConfigurationProperties(prefix = "im.gateway.ws")
public record GatewayProperties(
        String host,
        int port,
        String path
) {

    public String hostEffective() {
        return host == null || host.isBlank() ? "0.0.0.0" : host;
    }

    public int portEffective() {
        return port <= 0 ? 9001 : port;
    }

    public String pathEffective() {
        return path == null || path.isBlank() ? "/ws" : path;
    }
}
