package com.pulse.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * 릴레이 노드({@code /bus})에 WebSocket으로 붙는 버스 클라이언트.
 * 하나의 연결 위에서 채널마다 ref를 부여해 프레임을 다중화한다.
 * <p>
 * 연결이 끊기면 다시 연결하고, 열려 있던 채널의 subscribe와 track을 새 연결로 다시 보낸다.
 */
public class WebSocketRealtimeBus implements RealtimeBus, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRealtimeBus.class);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;
    private static final Duration RECONNECT_DELAY = Duration.ofMillis(500);

    private final WebSocketClient client;
    private final URI relayUrl;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;

    private final Map<String, RemoteChannel> channels = new ConcurrentHashMap<>(); // ref -> 채널
    private final AtomicLong refSequence = new AtomicLong();
    private final ScheduledExecutorService reconnector = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "relay-reconnect");
        thread.setDaemon(true);
        return thread;
    });
    private volatile WebSocketSession session;
    private volatile boolean closed;

    public WebSocketRealtimeBus(WebSocketClient client, URI relayUrl, ObjectMapper objectMapper,
            Duration connectTimeout) {
        this.client = client;
        this.relayUrl = relayUrl;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public BusChannel channel(String topic) {
        return new RemoteChannel(topic, "c" + refSequence.incrementAndGet());
    }

    @Override
    public void publish(String topic, String event, JsonNode payload) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("op", "publish");
        frame.put("topic", topic);
        frame.put("event", event);
        frame.set("payload", payload);
        sendFrame(frame);
    }

    @Override
    public void close() {
        closed = true;
        reconnector.shutdownNow();
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException ex) {
                log.warn("Failed to close relay connection: {}", ex.getMessage());
            }
        }
    }

    private synchronized WebSocketSession connection() {
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            return current;
        }
        if (closed) {
            throw new BusException("Relay client for " + relayUrl + " is closed");
        }
        CompletableFuture<WebSocketSession> handshake =
                client.execute(new RelayFrameHandler(), new WebSocketHttpHeaders(), relayUrl);
        try {
            WebSocketSession opened = handshake.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            WebSocketSession decorated =
                    new ConcurrentWebSocketSessionDecorator(opened, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
            session = decorated;
            log.info("Connected to relay {}", relayUrl);
            restoreChannels(decorated);
            return decorated;
        } catch (TimeoutException ex) {
            handshake.cancel(true);
            throw new BusTimeoutException("Timed out connecting to relay " + relayUrl);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new BusException("Interrupted while connecting to relay " + relayUrl, ex);
        } catch (ExecutionException ex) {
            throw new BusException("Failed to connect to relay " + relayUrl, ex.getCause());
        }
    }

    /**
     * 새 연결에 등록된 채널의 subscribe와 track 프레임을 다시 보낸다.
     * 보내지 못한 채널은 구독 해제 상태로 남고 오류 로그를 남긴다.
     */
    private void restoreChannels(WebSocketSession target) {
        for (RemoteChannel channel : channels.values()) {
            try {
                for (ObjectNode frame : channel.restoreFrames()) {
                    target.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
                }
                log.debug("Restoring subscription to {} on new relay connection", channel.topic);
            } catch (IOException ex) {
                log.error("Failed to restore subscription to {} after reconnect", channel.topic, ex);
            }
        }
    }

    private void scheduleReconnect() {
        if (closed || channels.isEmpty()) {
            return;
        }
        try {
            reconnector.schedule(this::reconnect, RECONNECT_DELAY.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.debug("Reconnect not scheduled, relay client is closing");
        }
    }

    private void reconnect() {
        if (closed) {
            return;
        }
        try {
            connection();
        } catch (BusException ex) {
            log.warn("Reconnect to relay {} failed: {}", relayUrl, ex.getMessage());
            scheduleReconnect();
        }
    }

    WebSocketSession currentSession() {
        return session;
    }

    private void sendFrame(ObjectNode frame) {
        WebSocketSession target = connection();
        try {
            target.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame)));
        } catch (IOException ex) {
            throw new BusException("Failed to send " + frame.path("op").asText() + " frame to relay", ex);
        }
    }

    private Map<String, PresenceEntry> readPresence(JsonNode node) {
        Map<String, PresenceEntry> state = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return state;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            state.put(field.getKey(), readEntry(field.getValue()));
        }
        return state;
    }

    private PresenceEntry readEntry(JsonNode node) {
        try {
            return objectMapper.treeToValue(node, PresenceEntry.class);
        } catch (JsonProcessingException ex) {
            throw new BusException("Malformed presence entry: " + node, ex);
        }
    }

    private class RelayFrameHandler extends TextWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession ws, TextMessage message) throws IOException {
            JsonNode frame = objectMapper.readTree(message.getPayload());
            String op = frame.path("op").asText();
            RemoteChannel channel = channels.get(frame.path("ref").asText());
            if (channel == null) {
                log.debug("Dropping {} frame for unknown ref {}", op, frame.path("ref").asText());
                return;
            }
            switch (op) {
                case "subscribed" -> channel.onSubscribed(readPresence(frame.get("presence")));
                case "message" -> channel.dispatch(frame.path("event").asText(), frame.get("payload"));
                case "presence" -> channel.onPresenceDiff(frame.path("kind").asText(),
                        frame.path("key").asText(), readEntry(frame.get("entry")), readPresence(frame.get("state")));
                case "error" -> log.warn("Relay rejected frame on {}: {}", channel.topic, frame.path("message").asText());
                default -> log.debug("Ignoring relay frame op {}", op);
            }
        }

        @Override
        public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
            WebSocketSession current = session;
            if (current instanceof ConcurrentWebSocketSessionDecorator
                    && ((ConcurrentWebSocketSessionDecorator) current).getDelegate() != ws) {
                log.debug("Ignoring close of superseded relay connection: {}", status);
                return;
            }
            session = null;
            for (RemoteChannel channel : channels.values()) {
                channel.subscribed = false;
            }
            if (closed) {
                log.info("Relay connection closed: {}", status);
                return;
            }
            log.warn("Relay connection lost: {}, reconnecting {} channel(s)", status, channels.size());
            scheduleReconnect();
        }
    }

    private final class RemoteChannel implements BusChannel {

        private final String topic;
        private final String ref;
        private final Map<String, List<Consumer<JsonNode>>> handlers = new ConcurrentHashMap<>();
        private final List<PresenceListener> presenceListeners = new CopyOnWriteArrayList<>();
        private volatile CompletableFuture<Void> ack = new CompletableFuture<>();
        private volatile Map<String, PresenceEntry> presence = Collections.emptyMap();
        private volatile boolean subscribed;
        private volatile PresenceEntry tracked;

        private RemoteChannel(String topic, String ref) {
            this.topic = topic;
            this.ref = ref;
        }

        @Override
        public String getTopic() {
            return topic;
        }

        @Override
        public void subscribe(Duration timeout) {
            if (subscribed) {
                return;
            }
            CompletableFuture<Void> pending = new CompletableFuture<>();
            ack = pending;
            // 재연결이 필요하면 등록 전에 끝내서 복구 프레임과 겹치지 않게 한다.
            connection();
            channels.put(ref, this);
            ObjectNode frame = frame("subscribe");
            frame.put("topic", topic);
            sendFrame(frame);
            try {
                pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                channels.remove(ref);
                throw new BusTimeoutException("Subscribe to " + topic + " not acknowledged within " + timeout);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new BusException("Interrupted while subscribing to " + topic, ex);
            } catch (ExecutionException ex) {
                throw new BusException("Subscribe to " + topic + " failed", ex.getCause());
            }
        }

        @Override
        public boolean isSubscribed() {
            return subscribed;
        }

        @Override
        public void on(String event, Consumer<JsonNode> handler) {
            handlers.computeIfAbsent(event, key -> new CopyOnWriteArrayList<>()).add(handler);
        }

        @Override
        public void onPresence(PresenceListener listener) {
            presenceListeners.add(listener);
        }

        @Override
        public void send(String event, JsonNode payload) {
            ObjectNode frame = frame("publish");
            frame.put("topic", topic);
            frame.put("event", event);
            frame.set("payload", payload);
            sendFrame(frame);
        }

        @Override
        public void track(PresenceEntry entry) {
            if (!subscribed) {
                throw new BusException("Cannot track presence before subscribing to " + topic);
            }
            sendFrame(trackFrame(entry));
            tracked = entry;
        }

        @Override
        public void untrack() {
            if (tracked == null) {
                return;
            }
            tracked = null;
            sendFrame(frame("untrack"));
        }

        @Override
        public Map<String, PresenceEntry> presenceState() {
            return subscribed ? presence : Collections.emptyMap();
        }

        @Override
        public void unsubscribe() {
            if (channels.remove(ref) == null) {
                return;
            }
            subscribed = false;
            WebSocketSession current = session;
            if (current == null || !current.isOpen()) {
                return;
            }
            try {
                current.sendMessage(new TextMessage(objectMapper.writeValueAsString(frame("unsubscribe"))));
            } catch (IOException ex) {
                log.warn("Failed to unsubscribe from {}: {}", topic, ex.getMessage());
            }
        }

        private List<ObjectNode> restoreFrames() {
            List<ObjectNode> frames = new ArrayList<>();
            ObjectNode subscribe = frame("subscribe");
            subscribe.put("topic", topic);
            frames.add(subscribe);
            PresenceEntry entry = tracked;
            if (entry != null) {
                frames.add(trackFrame(entry));
            }
            return frames;
        }

        private ObjectNode trackFrame(PresenceEntry entry) {
            ObjectNode frame = frame("track");
            frame.put("key", entry.getUserId());
            frame.set("entry", objectMapper.valueToTree(entry));
            return frame;
        }

        private ObjectNode frame(String op) {
            ObjectNode frame = objectMapper.createObjectNode();
            frame.put("op", op);
            frame.put("ref", ref);
            return frame;
        }

        private void onSubscribed(Map<String, PresenceEntry> state) {
            Map<String, PresenceEntry> previous = presence;
            presence = Collections.unmodifiableMap(state);
            subscribed = true;
            ack.complete(null);
            // 재연결 중에 놓친 join/leave는 이전 뷰와 비교해 알린다. 자기 항목은 track이 곧 다시 보낸다.
            PresenceEntry own = tracked;
            String ownKey = own == null ? null : own.getUserId();
            for (Map.Entry<String, PresenceEntry> entry : previous.entrySet()) {
                if (!state.containsKey(entry.getKey()) && !entry.getKey().equals(ownKey)) {
                    firePresence(listener -> listener.onLeave(entry.getKey(), entry.getValue()));
                }
            }
            if (!previous.isEmpty()) {
                for (Map.Entry<String, PresenceEntry> entry : state.entrySet()) {
                    if (!previous.containsKey(entry.getKey())) {
                        firePresence(listener -> listener.onJoin(entry.getKey(), entry.getValue()));
                    }
                }
            }
            firePresence(listener -> listener.onSync(presence));
        }

        private void onPresenceDiff(String kind, String key, PresenceEntry entry, Map<String, PresenceEntry> state) {
            presence = Collections.unmodifiableMap(state);
            firePresence(listener -> {
                if ("join".equals(kind)) {
                    listener.onJoin(key, entry);
                } else if ("leave".equals(kind)) {
                    listener.onLeave(key, entry);
                }
                listener.onSync(presence);
            });
        }

        private void dispatch(String event, JsonNode payload) {
            List<Consumer<JsonNode>> eventHandlers = handlers.get(event);
            if (eventHandlers == null) {
                return;
            }
            for (Consumer<JsonNode> handler : eventHandlers) {
                try {
                    handler.accept(payload);
                } catch (RuntimeException ex) {
                    log.error("Handler for {} on {} failed", event, topic, ex);
                }
            }
        }

        private void firePresence(Consumer<PresenceListener> action) {
            for (PresenceListener listener : presenceListeners) {
                try {
                    action.accept(listener);
                } catch (RuntimeException ex) {
                    log.error("Presence listener on {} failed", topic, ex);
                }
            }
        }
    }
}
