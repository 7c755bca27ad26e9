package com.convsync.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * accessToken 校验参数。token 由上游登录服务签发，本服务只校验（共享 HMAC 密钥与 issuer）。
 */
@ConfigurationProperties(prefix = "im.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long accessTokenTtlSeconds
) {

    public long accessTokenTtlSecondsEffective() {
        return accessTokenTtlSeconds <= 0 ? 1800 : accessTokenTtlSeconds;
    }
}
