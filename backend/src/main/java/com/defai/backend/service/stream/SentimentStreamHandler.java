package com.defai.backend.service.stream;

import com.defai.backend.config.OracleProperties;
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
public class SentimentStreamHandler extends TextWebSocketHandler {

    private final BroadcastHub hub;
    private final SentimentStreamService streamService;
    private final OracleProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        OracleProperties.Stream stream = properties.getStream();
        WebSocketSubscriber subscriber = new WebSocketSubscriber(session, stream.getSendTimeLimitMs(),
                stream.getBufferSizeLimit());
        hub.connect(subscriber, streamService.connectionMessage());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        streamService.handleClientMessage(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on {}: {}", session.getId(), exception.getMessage());
        hub.disconnect(session.getId(), "transport error");
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.disconnect(session.getId(), "closed " + status.getCode());
    }
}
