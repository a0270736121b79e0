package com.disksentinel.websocket;

import com.disksentinel.config.ApplicationConfig;
import com.disksentinel.model.ScanEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 推送通道 /ws
 *
 * - 连接建立：注册到 EventBus，发送 {"type":"info","message":"connected"}
 * - pong：刷新存活时间
 * - 文本消息：{"action":"ping"} 回 pong，其他合法 JSON 原样回显，非法 JSON 回 error
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScanWebSocketHandler extends TextWebSocketHandler {

    static final String SUBSCRIBER_ATTR = "subscriber";
    static final String HANDLE_ATTR = "subscriptionHandle";

    private final EventBus eventBus;
    private final ObjectMapper mapper;
    private final ApplicationConfig config;

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        ApplicationConfig.Websocket ws = config.getWebsocket();
        WebSocketSubscriber subscriber = new WebSocketSubscriber(
                session, (int) ws.getSendTimeLimit().toMillis(), ws.getSendBufferSizeLimit());
        session.getAttributes().put(SUBSCRIBER_ATTR, subscriber);
        SubscriptionHandle handle = eventBus.subscribe(subscriber, ScanEvent.info("connected"));
        session.getAttributes().put(HANDLE_ATTR, handle);
        log.info("Client connected: {} from {}", session.getId(), session.getRemoteAddress());
    }

    @Override
    public void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        touch(session);
        SubscriptionHandle handle = handleOf(session);
        if (handle == null) return;

        JsonNode root;
        try {
            root = mapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Invalid JSON from client {}: {}", session.getId(), e.getOriginalMessage());
            eventBus.send(handle, ScanEvent.error("Invalid JSON format"));
            return;
        }
        log.info("WebSocket received from {}: {}", session.getId(), root);

        String action = root.path("action").asText("").toLowerCase();
        if ("ping".equals(action)) {
            eventBus.send(handle, ScanEvent.info("pong"));
            return;
        }
        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("type", "info");
        echo.put("message", "echo");
        echo.put("echo", root);
        eventBus.send(handle, echo);
    }

    @Override
    protected void handlePongMessage(@NonNull WebSocketSession session, @NonNull PongMessage message) {
        touch(session);
        log.debug("WebSocket pong received from {}", session.getId());
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.warn("Transport error on {}: {}", session.getId(), exception.getMessage());
        release(session);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        release(session);
        log.info("Client disconnected: {} ({})", session.getId(), status);
    }

    private void release(WebSocketSession session) {
        SubscriptionHandle handle = handleOf(session);
        if (handle != null) {
            eventBus.unsubscribe(handle);
        }
    }

    private void touch(WebSocketSession session) {
        Object s = session.getAttributes().get(SUBSCRIBER_ATTR);
        if (s instanceof WebSocketSubscriber subscriber) {
            subscriber.markAlive();
        }
    }

    private static SubscriptionHandle handleOf(WebSocketSession session) {
        Object h = session.getAttributes().get(HANDLE_ATTR);
        return h instanceof SubscriptionHandle handle ? handle : null;
    }
}
