package com.suraksha.safetymonitor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

/**
 * STOMP over WebSocket for monitoring dashboards.
 *
 * Clients connect to /ws and subscribe to any number of /topic/{topic}
 * destinations over the one connection. Server to client only.
 *
 * Slow consumers: each session has a bounded send buffer and send time limit.
 * When either is exceeded Spring closes that session, so a stuck dashboard can
 * never back-pressure the publisher. Per-session publish order is preserved.
 */
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final SafetyProperties properties;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic");
        config.setPreservePublishOrder(true);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // SockJS endpoint - falls back to long-polling if WS not supported
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(properties.getBroadcast().getAllowedOriginPatterns().toArray(new String[0]))
                .withSockJS();
    }

    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setSendBufferSizeLimit(properties.getBroadcast().getSendBufferSizeBytes());
        registration.setSendTimeLimit(properties.getBroadcast().getSendTimeLimitMs());
    }
}
