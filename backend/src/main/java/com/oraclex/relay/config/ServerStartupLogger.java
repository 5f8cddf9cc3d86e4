package com.oraclex.relay.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final RelayProperties relayProperties;
    private final AllowedOriginResolver allowedOriginResolver;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String address = environment.getProperty("server.address");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        String baseUrl = String.format("http://%s:%d", host, port);
        log.info("{} v{} listening on port {} (base URL: {})",
                relayProperties.getName(), relayProperties.getVersion(), port, baseUrl);
        log.info("Producer -> POST {}/update-market-state | Analysis -> POST {}/market-analysis | Dashboard -> GET {}/get-market-state",
                baseUrl, baseUrl, baseUrl);
        if (allowedOriginResolver.allowsAnyOrigin()) {
            log.info("CORS: any origin allowed");
        } else {
            log.info("CORS: allowed origins {}", allowedOriginResolver.resolveCorsAllowedOrigins());
        }
    }
}
