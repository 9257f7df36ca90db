package io.fieldsync.server.transport;

import io.fieldsync.server.presence.SessionChannel;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;

import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SessionChannel} over an Undertow WebSocket connection.
 * Sends are asynchronous; late failures are logged here.
 */
final class WebSocketSessionChannel implements SessionChannel {
    private static final Logger log = Logger.getLogger(WebSocketSessionChannel.class.getName());

    private final String id;
    private final WebSocketChannel channel;

    WebSocketSessionChannel(String id, WebSocketChannel channel) {
        this.id = Objects.requireNonNull(id, "id");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(String text) throws IOException {
        if (!channel.isOpen() || channel.isCloseFrameSent()) {
            throw new IOException("session " + id + " is closed");
        }
        WebSockets.sendText(text, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                // delivered
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.log(Level.WARNING, "send to session " + id + " failed", throwable);
            }
        });
    }

    @Override
    public String toString() {
        return "session " + id;
    }
}
