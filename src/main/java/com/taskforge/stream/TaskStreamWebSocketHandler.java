package com.taskforge.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

@Component
public class TaskStreamWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(TaskStreamWebSocketHandler.class);

    private final TaskStreamHub hub;

    public TaskStreamWebSocketHandler(TaskStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        Map<String, String> queryParams = UriComponentsBuilder.fromUri(uri).build().getQueryParams().toSingleValueMap();
        Long taskId = parseLong(queryParams.get("taskId"), null);
        if (taskId == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        long since = parseLong(queryParams.get("since"), 0L);
        hub.registerSession(taskId, session, since);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // Observers only receive.
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.removeSession(session);
    }

    private Long parseLong(String value, Long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            log.debug("Invalid numeric query parameter {}", value);
            return fallback;
        }
    }
}
