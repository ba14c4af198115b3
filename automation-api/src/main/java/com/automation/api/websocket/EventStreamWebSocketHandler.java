package com.automation.api.websocket;

import com.automation.core.exception.AutomationException;
import com.automation.core.model.Event;
import com.automation.engine.logging.LoggingContext;
import com.automation.engine.service.EventService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.List;

/**
 * Streaming ingestion: every text frame is one JSON event, published on receipt.
 *
 * A frame that cannot be read or fails validation is logged and skipped;
 * the session stays open. Nothing is sent back to the client.
 */
@Component
public class EventStreamWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(EventStreamWebSocketHandler.class);

    private final EventService eventService;
    private final ObjectMapper objectMapper;

    public EventStreamWebSocketHandler(EventService eventService, ObjectMapper objectMapper) {
        this.eventService = eventService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        try (var ctx = LoggingContext.forSession(session.getId())) {
            log.info("Event stream opened from {}", session.getRemoteAddress());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        try (var ctx = LoggingContext.forSession(session.getId())) {
            Event event;
            try {
                event = objectMapper.readValue(message.getPayload(), Event.class);
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable event frame: {}", e.getOriginalMessage());
                return;
            }
            try {
                eventService.publish(List.of(event));
            } catch (AutomationException e) {
                log.warn("Skipping event {} ({}): {}", event.id(), e.getErrorCode(), e.getMessage());
            }
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        try (var ctx = LoggingContext.forSession(session.getId())) {
            log.info("Event stream closed ({})", status.getCode());
        }
    }
}
