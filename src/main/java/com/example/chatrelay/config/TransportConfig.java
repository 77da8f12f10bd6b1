package com.example.chatrelay.config;

import com.example.chatrelay.transport.GatewayTransport;
import com.example.chatrelay.transport.LocalSessionTransport;
import com.example.chatrelay.transport.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class TransportConfig {

    private static final Logger logger = LoggerFactory.getLogger(TransportConfig.class);

    @Bean
    public LocalSessionTransport localSessionTransport(
            @Value("${app.websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
            @Value("${app.websocket.buffer-size-limit:524288}") int bufferSizeLimit) {
        return new LocalSessionTransport(sendTimeLimitMs, bufferSizeLimit);
    }

    /**
     * Transport used by the delivery stage: local WebSocket sessions, or an
     * external gateway when {@code app.transport.mode=gateway}.
     */
    @Bean
    @Primary
    public Transport deliveryTransport(LocalSessionTransport localSessionTransport,
                                       @Value("${app.transport.mode:local}") String mode,
                                       @Value("${app.gateway.endpoint:}") String endpoint,
                                       @Value("${app.gateway.timeout-ms:20000}") int timeoutMs) {
        if ("gateway".equals(mode)) {
            if (endpoint.isBlank()) {
                throw new IllegalStateException("app.gateway.endpoint must be set when app.transport.mode=gateway");
            }
            logger.info("Delivering through gateway {}", endpoint);
            return GatewayTransport.create(endpoint, timeoutMs);
        }
        logger.info("Delivering to local WebSocket sessions");
        return localSessionTransport;
    }
}
