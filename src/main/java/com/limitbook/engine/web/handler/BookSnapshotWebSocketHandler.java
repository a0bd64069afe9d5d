package com.limitbook.engine.web.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.limitbook.engine.config.EngineProperties;
import com.limitbook.engine.core.event.BookSnapshotPublishedEvent;
import com.limitbook.engine.web.dto.OrderBookDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes every published book snapshot to connected clients.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookSnapshotWebSocketHandler extends TextWebSocketHandler {

    private final Set<WebSocketSession> sessions = ConcurrentHashMap.newKeySet();
    private final Map<String, Long> lastSentVersions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final EngineProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.add(session);
        log.info("WS: Client connected, sessionId={}, total sessions={}", session.getId(), sessions.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session);
        log.info("WS: Client disconnected, sessionId={}, status={}, remaining sessions={}",
                session.getId(), status, sessions.size());
    }

    public int getSessionCount() {
        return sessions.size();
    }

    @EventListener
    public void handleSnapshotPublished(BookSnapshotPublishedEvent event) {
        if (!advanceVersion(event.getSnapshot().getSymbol(), event.getSnapshot().getVersion())) {
            log.debug("WS: Dropping stale {} v{}", event.getSnapshot().getSymbol(), event.getSnapshot().getVersion());
            return;
        }
        if (sessions.isEmpty()) {
            log.trace("WS: No active sessions, skipping snapshot broadcast");
            return;
        }

        String message;
        try {
            OrderBookDto dto = OrderBookDto.from(event.getSnapshot(), properties.getSnapshot().getDepth());
            // Wrap in "type/data" envelope
            message = objectMapper.writeValueAsString(new WebSocketMessage("BOOK_SNAPSHOT", dto));
        } catch (IOException e) {
            log.error("WS: Failed to serialize snapshot of {}", event.getSnapshot().getSymbol(), e);
            return;
        }

        int sentCount = 0;
        for (WebSocketSession session : sessions) {
            if (!session.isOpen()) {
                continue;
            }
            try {
                // Sends on one session must not overlap
                synchronized (session) {
                    session.sendMessage(new TextMessage(message));
                }
                sentCount++;
            } catch (IOException e) {
                log.warn("WS: Failed to send snapshot to session {}, dropping it: {}", session.getId(), e.getMessage());
                sessions.remove(session);
            }
        }
        log.trace("WS: Sent {} v{} to {} open sessions",
                event.getSnapshot().getSymbol(), event.getSnapshot().getVersion(), sentCount);
    }

    /**
     * Records {@code version} as the latest sent for the symbol. False when a newer or equal one went out already.
     */
    private boolean advanceVersion(String symbol, long version) {
        boolean[] advanced = {false};
        lastSentVersions.compute(symbol, (key, previous) -> {
            if (previous == null || version > previous) {
                advanced[0] = true;
                return version;
            }
            return previous;
        });
        return advanced[0];
    }

    private record WebSocketMessage(String type, Object data) {}
}
