package com.routeclip.service;

import com.routeclip.service.port.NotificationChannel;
import lombok.Getter;

@Getter
public class ActiveConnection {

    private final Long userId;
    private final NotificationChannel channel;
    private volatile NotificationLoop loop;

    public ActiveConnection(Long userId, NotificationChannel channel) {
        this.userId = userId;
        this.channel = channel;
    }

    void bind(NotificationLoop loop) {
        this.loop = loop;
    }

    /**
     * Stops the bound loop and closes the channel. Idempotent.
     */
    public void close() {
        NotificationLoop current = loop;
        if (current != null) {
            current.stop();
        }
        channel.close();
    }

    @Override
    public String toString() {
        return "ActiveConnection{userId=" + userId + "}";
    }
}
