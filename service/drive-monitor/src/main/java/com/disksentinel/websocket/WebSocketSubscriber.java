package com.disksentinel.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * WebSocket 会话适配。会话包装为 ConcurrentWebSocketSessionDecorator，
 * 投递线程、心跳线程与请求线程可以并发发送；发送缓冲超限时抛出异常，订阅者随即被移除。
 */
@Slf4j
public class WebSocketSubscriber implements Subscriber {

    private static final byte[] PING_PAYLOAD = "ping".getBytes(StandardCharsets.US_ASCII);

    private final WebSocketSession session;
    private volatile long lastActivityMs;

    public WebSocketSubscriber(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
        this.lastActivityMs = System.currentTimeMillis();
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void ping() throws IOException {
        session.sendMessage(new PingMessage(ByteBuffer.wrap(PING_PAYLOAD)));
        log.debug("WebSocket ping sent to {}", getId());
    }

    public void markAlive() {
        lastActivityMs = System.currentTimeMillis();
    }

    @Override
    public long getLastActivityMs() {
        return lastActivityMs;
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", getId(), e.getMessage());
        }
    }
}
