package com.routeclip.web.ws;

import com.routeclip.service.ActiveConnection;
import com.routeclip.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTR = "routeclip.connection";

    private final NotificationService notificationService;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        Object userId = session.getAttributes().get(UserIdHandshakeInterceptor.USER_ID_ATTR);
        if (!(userId instanceof Long)) {
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        ActiveConnection connection = notificationService.open((Long) userId, new WebSocketNotificationChannel(session));
        session.getAttributes().put(CONNECTION_ATTR, connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // push-only channel
        log.debug("ignoring inbound frame on session {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("transport error on session {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        release(session);
    }

    private void release(WebSocketSession session) {
        Object connection = session.getAttributes().get(CONNECTION_ATTR);
        if (connection instanceof ActiveConnection) {
            notificationService.close((ActiveConnection) connection);
        }
    }
}
