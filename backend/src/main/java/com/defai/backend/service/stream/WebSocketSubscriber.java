package com.defai.backend.service.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

@Slf4j
public class WebSocketSubscriber implements Subscriber {

    private final WebSocketSession session;

    public WebSocketSubscriber(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("Session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
