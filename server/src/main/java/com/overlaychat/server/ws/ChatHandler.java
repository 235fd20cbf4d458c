package com.overlaychat.server.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.overlaychat.server.model.Command;
import com.overlaychat.server.model.InboundEnvelope;
import com.overlaychat.server.model.JoinRoomRequest;
import com.overlaychat.server.room.RoomManager;
import com.overlaychat.server.room.Subscriber;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.Set;

/**
 * Overlay connection handler:
 * - 连接建立：还没有房间
 * - 第一条 JOIN_ROOM 消息：记下 roomId（只能设置一次）并登记到 RoomManager
 * - 之后的消息和未知命令：记录警告后忽略，连接保持
 * - 连接关闭：从 RoomManager 移除
 */
@Component
public class ChatHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatHandler.class);

    static final String ATTR_ROOM_ID = "overlay.roomId";
    static final String ATTR_SUBSCRIBER = "overlay.subscriber";

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ObjectMapper mapper;
    private final RoomManager roomManager;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public ChatHandler(ObjectMapper mapper,
                       RoomManager roomManager,
                       @Value("${overlay.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
                       @Value("${overlay.ws.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.mapper = mapper;
        this.roomManager = roomManager;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        session.getAttributes().put(ATTR_SUBSCRIBER, new SessionSubscriber(session, sendTimeLimitMs, bufferSizeLimit));
        log.info("[CONNECT] session={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Map<String, Object> attrs = session.getAttributes();
        Object assigned = attrs.get(ATTR_ROOM_ID);
        if (assigned != null) {
            log.warn("[WARN] session={} already in room={}, message ignored", session.getId(), assigned);
            return;
        }

        // 1) 解析 JSON
        InboundEnvelope envelope;
        try {
            envelope = mapper.readValue(message.getPayload(), InboundEnvelope.class);
        } catch (Exception e) {
            log.warn("[WARN] invalid json: {}", e.getMessage());
            return;
        }
        if (!isValid(envelope)) return;

        // 2) 只接受 JOIN_ROOM
        if (Command.fromCode(envelope.cmd) != Command.JOIN_ROOM) {
            log.warn("[WARN] unknown cmd: {} data: {}", envelope.cmd, envelope.data);
            return;
        }
        if (envelope.data == null || envelope.data.isNull()) {
            log.warn("[WARN] join without data, session={}", session.getId());
            return;
        }

        JoinRoomRequest join;
        try {
            join = mapper.treeToValue(envelope.data, JoinRoomRequest.class);
        } catch (Exception e) {
            log.warn("[WARN] invalid join data {}: {}", envelope.data, e.getMessage());
            return;
        }
        if (!isValid(join)) return;

        // 3) 登记
        if (attrs.putIfAbsent(ATTR_ROOM_ID, join.roomId) != null) return;
        log.info("[JOIN-REQ] session={} remote={} room={}", session.getId(), session.getRemoteAddress(), join.roomId);
        roomManager.addSubscriber(join.roomId, subscriber(session));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object roomId = session.getAttributes().get(ATTR_ROOM_ID);
        log.info("[DISCONNECT] session={} room={} status={}", session.getId(), roomId, status);
        if (roomId instanceof Long id) {
            roomManager.removeSubscriber(id, subscriber(session));
        }
    }

    private <T> boolean isValid(T value) {
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            log.warn("[WARN] validation failed: {}", violations);
            return false;
        }
        return true;
    }

    private Subscriber subscriber(WebSocketSession session) {
        return (Subscriber) session.getAttributes().computeIfAbsent(ATTR_SUBSCRIBER,
                k -> new SessionSubscriber(session, sendTimeLimitMs, bufferSizeLimit));
    }
}
