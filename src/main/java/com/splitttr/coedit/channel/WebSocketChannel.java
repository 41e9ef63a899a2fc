package com.splitttr.coedit.channel;

import io.quarkus.websockets.next.WebSocketConnection;

import java.time.Duration;

/**
 * {@link ParticipantChannel} over a websockets-next connection. Sends wait at most
 * {@code sendTimeout} so a stalled client cannot hold up delivery to the others.
 */
public class WebSocketChannel implements ParticipantChannel {

    private final WebSocketConnection connection;
    private final Duration sendTimeout;

    public WebSocketChannel(WebSocketConnection connection, Duration sendTimeout) {
        this.connection = connection;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public String id() {
        return connection.id();
    }

    @Override
    public DeliveryResult send(String payload) {
        if (!connection.isOpen()) {
            return DeliveryResult.failed(new IllegalStateException("Connection " + connection.id() + " is closed"));
        }
        try {
            connection.sendText(payload).await().atMost(sendTimeout);
            return DeliveryResult.ok();
        } catch (RuntimeException e) {
            return DeliveryResult.failed(e);
        }
    }
}
