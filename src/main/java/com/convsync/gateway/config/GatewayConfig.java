package com.convsync.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        GatewayProperties.class,
        WsBackpressureProperties.class,
        WsSessionProperties.class
})
public class GatewayConfig {
}
