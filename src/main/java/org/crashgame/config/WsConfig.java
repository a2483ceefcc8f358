package org.crashgame.config;

import org.crashgame.security.GuestHandshakeHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.*;

@Configuration
@EnableWebSocketMessageBroker
public class WsConfig implements WebSocketMessageBrokerConfigurer {

    private final GuestHandshakeHandler guestHandshakeHandler;

    // mêmes origines que CORS
    @Value("${app.cors.allowed-origins:http://localhost:4200}")
    private String allowedOrigins;

    public WsConfig(GuestHandshakeHandler guestHandshakeHandler) {
        this.guestHandshakeHandler = guestHandshakeHandler;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] patterns = allowedOrigins.split("\\s*,\\s*");
        registry.addEndpoint("/ws")
                .setHandshakeHandler(guestHandshakeHandler)
                .setAllowedOriginPatterns(patterns)
                .withSockJS();
    }

    // un client lent est coupé plutôt que de retenir les envois des autres
    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registry) {
        registry.setMessageSizeLimit(16 * 1024)
                .setSendBufferSizeLimit(512 * 1024)
                .setSendTimeLimit(5_000);
    }

    private ThreadPoolTaskScheduler heartbeatScheduler() {
        ThreadPoolTaskScheduler ts = new ThreadPoolTaskScheduler();
        ts.setPoolSize(1);
        ts.setThreadNamePrefix("ws-heartbeat-");
        ts.initialize();
        return ts;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        var simple = registry.enableSimpleBroker("/topic", "/queue");
        simple.setTaskScheduler(heartbeatScheduler());
        simple.setHeartbeatValue(new long[]{10_000, 10_000});
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
        // MULTIPLIER puis CRASH doivent arriver dans cet ordre
        registry.setPreservePublishOrder(true);
    }
}
