package com.overlaychat.server.ws;

import com.overlaychat.server.room.Subscriber;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Subscriber backed by a WebSocket session. Writes go through a concurrent decorator so the
 * session is never written from two threads at once; the room calls {@link #send} from the
 * subscriber's own delivery lane.
 */
public class SessionSubscriber implements Subscriber {

    private final WebSocketSession session;

    public SessionSubscriber(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session closed");
        }
        session.sendMessage(new TextMessage(payload));
    }
}
