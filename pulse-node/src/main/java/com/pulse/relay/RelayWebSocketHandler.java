package com.pulse.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 여러 노드의 버스 클라이언트를 중계하는 릴레이 핸들러.
 * 토픽 구독, 이벤트 팬아웃, presence 추적을 담당한다.
 */
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    private final ObjectMapper objectMapper;

    // 인메모리 상태 (스레드 안전성을 위해 ConcurrentHashMap 사용)
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>(); // 세션 ID -> WebSocket 세션
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>(); // 세션 ID + ref -> 구독자
    private final Map<String, Set<Subscriber>> topicSubscribers = new ConcurrentHashMap<>(); // 토픽 -> 구독자 목록
    private final Map<String, Map<String, PresenceRecord>> presence = new ConcurrentHashMap<>(); // 토픽 -> presence 키 -> 항목

    public RelayWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(session, 10_000, 512 * 1024));
        log.debug("Relay client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        JsonNode frame = objectMapper.readTree(message.getPayload());
        String op = requiredText(frame, "op");
        try {
            switch (op) {
                case "subscribe" -> handleSubscribe(session, frame);
                case "unsubscribe" -> handleUnsubscribe(session, frame);
                case "publish" -> handlePublish(session, frame);
                case "track" -> handleTrack(session, frame);
                case "untrack" -> handleUntrack(session, frame);
                default -> sendError(session, optionalText(frame, "ref"), "Unknown op: " + op);
            }
        } catch (IllegalArgumentException ex) {
            log.warn("Relay op {} failed: {}", op, ex.getMessage());
            sendError(session, optionalText(frame, "ref"), ex.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        // 연결이 끊어지면 해당 세션의 모든 구독과 presence를 정리한다.
        sessions.remove(session.getId());
        String prefix = session.getId() + "/";
        subscribers.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .toList()
                .forEach(this::removeSubscriber);
        log.debug("Relay client disconnected: {} ({})", session.getId(), status);
    }

    private void handleSubscribe(WebSocketSession session, JsonNode frame) {
        String ref = requiredText(frame, "ref");
        String topic = requiredText(frame, "topic");
        // 같은 ref로 다시 subscribe하면 기존 구독과 presence를 유지한 채 스냅샷만 다시 보낸다.
        Subscriber subscriber = subscribers.computeIfAbsent(session.getId() + "/" + ref,
                key -> new Subscriber(session.getId(), ref, topic));
        topicSubscribers.computeIfAbsent(subscriber.topic, key -> ConcurrentHashMap.newKeySet()).add(subscriber);

        ObjectNode response = objectMapper.createObjectNode();
        response.put("op", "subscribed");
        response.put("ref", ref);
        response.set("presence", presenceNode(subscriber.topic));
        send(session.getId(), response);
    }

    private void handleUnsubscribe(WebSocketSession session, JsonNode frame) {
        removeSubscriber(session.getId() + "/" + requiredText(frame, "ref"));
    }

    private void handlePublish(WebSocketSession session, JsonNode frame) {
        String topic = requiredText(frame, "topic");
        String event = requiredText(frame, "event");
        String ref = optionalText(frame, "ref");
        String senderKey = ref == null ? null : session.getId() + "/" + ref;
        JsonNode payload = frame.get("payload");
        for (Subscriber subscriber : topicSubscribers.getOrDefault(topic, Set.of())) {
            // 보낸 채널 자신에게는 되돌려 보내지 않는다.
            if (subscriber.key().equals(senderKey)) {
                continue;
            }
            ObjectNode message = objectMapper.createObjectNode();
            message.put("op", "message");
            message.put("ref", subscriber.ref);
            message.put("event", event);
            message.set("payload", payload);
            send(subscriber.sessionId, message);
        }
    }

    private void handleTrack(WebSocketSession session, JsonNode frame) {
        Subscriber subscriber = requireSubscriber(session, frame);
        String key = requiredText(frame, "key");
        JsonNode entry = frame.get("entry");
        if (entry == null || !entry.isObject()) {
            throw new IllegalArgumentException("entry is required");
        }
        presence.computeIfAbsent(subscriber.topic, topic -> new ConcurrentHashMap<>())
                .put(key, new PresenceRecord(subscriber.key(), entry));
        subscriber.trackedKey = key;
        broadcastPresence(subscriber.topic, "join", key, entry);
    }

    private void handleUntrack(WebSocketSession session, JsonNode frame) {
        untrack(requireSubscriber(session, frame));
    }

    private void removeSubscriber(String subscriberKey) {
        Subscriber subscriber = subscribers.remove(subscriberKey);
        if (subscriber == null) {
            return;
        }
        Set<Subscriber> members = topicSubscribers.get(subscriber.topic);
        if (members != null) {
            members.remove(subscriber);
        }
        untrack(subscriber);
    }

    private void untrack(Subscriber subscriber) {
        String key = subscriber.trackedKey;
        if (key == null) {
            return;
        }
        subscriber.trackedKey = null;
        Map<String, PresenceRecord> records = presence.get(subscriber.topic);
        if (records == null) {
            return;
        }
        PresenceRecord record = records.get(key);
        // 같은 키를 다른 연결이 다시 track했다면 그 항목은 건드리지 않는다.
        if (record == null || !record.ownerKey.equals(subscriber.key())) {
            return;
        }
        records.remove(key);
        broadcastPresence(subscriber.topic, "leave", key, record.entry);
    }

    private void broadcastPresence(String topic, String kind, String key, JsonNode entry) {
        ObjectNode state = presenceNode(topic);
        for (Subscriber subscriber : topicSubscribers.getOrDefault(topic, Set.of())) {
            ObjectNode message = objectMapper.createObjectNode();
            message.put("op", "presence");
            message.put("ref", subscriber.ref);
            message.put("kind", kind);
            message.put("key", key);
            message.set("entry", entry);
            message.set("state", state);
            send(subscriber.sessionId, message);
        }
    }

    private ObjectNode presenceNode(String topic) {
        ObjectNode node = objectMapper.createObjectNode();
        Map<String, PresenceRecord> records = presence.get(topic);
        if (records != null) {
            new LinkedHashMap<>(records).forEach((key, record) -> node.set(key, record.entry));
        }
        return node;
    }

    private Subscriber requireSubscriber(WebSocketSession session, JsonNode frame) {
        String ref = requiredText(frame, "ref");
        Subscriber subscriber = subscribers.get(session.getId() + "/" + ref);
        if (subscriber == null) {
            throw new IllegalArgumentException("Not subscribed: " + ref);
        }
        return subscriber;
    }

    private String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private String optionalText(JsonNode node, String field) {
        JsonNode valueNode = node.get(field);
        if (valueNode == null || valueNode.isNull()) {
            return null;
        }
        return valueNode.asText();
    }

    private void send(String sessionId, ObjectNode payload) {
        WebSocketSession session = sessions.get(sessionId);
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(payload.toString()));
        } catch (IOException ex) {
            log.error("Failed to send relay frame to session {}", sessionId, ex);
        }
    }

    private void sendError(WebSocketSession session, String ref, String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("op", "error");
        if (ref != null) {
            error.put("ref", ref);
        }
        error.put("message", message);
        send(session.getId(), error);
    }

    private static final class Subscriber {
        private final String sessionId;
        private final String ref;
        private final String topic;
        private volatile String trackedKey;

        private Subscriber(String sessionId, String ref, String topic) {
            this.sessionId = sessionId;
            this.ref = ref;
            this.topic = topic;
        }

        private String key() {
            return sessionId + "/" + ref;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Subscriber)) {
                return false;
            }
            return key().equals(((Subscriber) o).key());
        }

        @Override
        public int hashCode() {
            return Objects.hash(sessionId, ref);
        }
    }

    private static final class PresenceRecord {
        private final String ownerKey;
        private final JsonNode entry;

        private PresenceRecord(String ownerKey, JsonNode entry) {
            this.ownerKey = ownerKey;
            this.entry = entry;
        }
    }
}
