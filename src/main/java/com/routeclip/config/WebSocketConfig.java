package com.routeclip.config;

import com.routeclip.web.ws.NotificationWebSocketHandler;
import com.routeclip.web.ws.UserIdHandshakeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String NOTIFICATIONS_PATH = "/ws/notifications";

    private final NotificationWebSocketHandler handler;
    private final UserIdHandshakeInterceptor userIdInterceptor;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, NOTIFICATIONS_PATH)
                .addInterceptors(userIdInterceptor)
                .setAllowedOriginPatterns("*");
    }
}
