package com.routeclip.web.ws;

import com.routeclip.service.port.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

@Slf4j
public class WebSocketNotificationChannel implements NotificationChannel {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketNotificationChannel(WebSocketSession session) {
        // serialises sends from the scheduler threads
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
