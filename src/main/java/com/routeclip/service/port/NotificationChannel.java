package com.routeclip.service.port;

import java.io.IOException;

/**
 * Duplex connection to one user, used only to push text messages.
 */
public interface NotificationChannel {

    void send(String text) throws IOException;

    /**
     * Closes the underlying session. Safe to call on an already closed channel.
     */
    void close();

    boolean isOpen();
}
