package com.pulse.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulse.bus.BusChannel;
import com.pulse.bus.BusException;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.support.Subscription;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 한 참가자의 시그널 송수신을 담당한다.
 * 방 토픽(host-update)과 개인 수신함(signal)을 구독하고, 자신에게 온 메시지만 리스너에 전달한다.
 */
public class SignalRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SignalRouter.class);

    static final int MAX_BACKLOG = 256;

    private final RealtimeBus bus;
    private final ObjectMapper objectMapper;
    private final String selfId;
    private final Duration subscribeTimeout;
    private final OutboundChannelPool outbound;

    private final List<Consumer<SignalMessage>> listeners = new CopyOnWriteArrayList<>();
    // 첫 리스너가 등록되기 전에 도착한 메시지
    private final Deque<SignalMessage> backlog = new ArrayDeque<>();
    private final Object dispatchLock = new Object();

    private BusChannel roomChannel;
    private BusChannel inboxChannel;
    private String roomId;

    public SignalRouter(RealtimeBus bus, ObjectMapper objectMapper, String selfId, Duration subscribeTimeout,
            Duration outboundIdleTtl, int outboundMaxChannels) {
        this.bus = bus;
        this.objectMapper = objectMapper;
        this.selfId = Objects.requireNonNull(selfId, "selfId");
        this.subscribeTimeout = subscribeTimeout;
        this.outbound = new OutboundChannelPool(bus, subscribeTimeout, outboundIdleTtl, outboundMaxChannels,
                Clock.systemUTC(), recipient -> log.debug("Outbound channel to {} released", recipient));
    }

    public String getSelfId() {
        return selfId;
    }

    public String getRoomId() {
        return roomId;
    }

    /**
     * 방 토픽과 개인 수신함을 구독한다. 이미 초기화되어 있으면 기존 구독을 닫고 다시 연다.
     */
    public synchronized void init(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId is required");
        }
        if (this.roomId != null) {
            closeChannels();
        }
        this.roomId = roomId;

        BusChannel room = bus.channel(Topics.room(roomId));
        room.on(Topics.EVENT_HOST_UPDATE, this::onBusPayload);
        BusChannel inbox = bus.channel(Topics.inbox(selfId));
        inbox.on(Topics.EVENT_SIGNAL, this::onBusPayload);
        try {
            room.subscribe(subscribeTimeout);
            inbox.subscribe(subscribeTimeout);
        } catch (BusException ex) {
            room.unsubscribe();
            inbox.unsubscribe();
            this.roomId = null;
            throw ex;
        }
        roomChannel = room;
        inboxChannel = inbox;
        log.info("Signaling attached to room {} as {}", roomId, selfId);
    }

    /**
     * 시그널을 보낸다. host-elected는 방 전체에, 나머지는 수신자 개인 토픽으로 간다.
     *
     * @throws IllegalArgumentException 자기 자신에게 보내려는 경우
     * @throws SignalingException 버스 전송이 실패한 경우
     */
    public void send(String to, SignalType type, Object payload) {
        Objects.requireNonNull(type, "type");
        if (selfId.equals(to)) {
            throw new IllegalArgumentException("Refusing to send " + type.toValue() + " signal to self");
        }
        JsonNode data = type == SignalType.ICE ? normalizeIce(payload) : objectMapper.valueToTree(payload);

        if (type == SignalType.HOST_ELECTED) {
            BusChannel room = roomChannel;
            if (room == null) {
                throw new SignalingException("Room channel not initialized");
            }
            SignalMessage message = new SignalMessage(selfId, SignalMessage.BROADCAST, type, data);
            try {
                room.send(Topics.EVENT_HOST_UPDATE, objectMapper.valueToTree(message));
            } catch (BusException ex) {
                throw new SignalingException("Failed to broadcast host announcement", ex);
            }
            log.debug("Broadcast {} to room {}", type.toValue(), roomId);
            return;
        }

        if (to == null || to.isBlank() || SignalMessage.BROADCAST.equals(to)) {
            throw new IllegalArgumentException("A single recipient is required for " + type.toValue());
        }
        SignalMessage message = new SignalMessage(selfId, to, type, data);
        try {
            outbound.acquire(to).send(Topics.EVENT_SIGNAL, objectMapper.valueToTree(message));
        } catch (BusException ex) {
            outbound.release(to);
            throw new SignalingException("Failed to send " + type.toValue() + " to " + to, ex);
        }
        log.debug("Sent {} to {}", type.toValue(), to);
    }

    /**
     * 자신에게 주소 지정된 시그널 리스너를 등록한다. 첫 등록 시 대기 중이던 메시지를 먼저 전달한다.
     */
    public Subscription onMessage(Consumer<SignalMessage> listener) {
        List<SignalMessage> replay;
        synchronized (dispatchLock) {
            listeners.add(listener);
            replay = new ArrayList<>(backlog);
            backlog.clear();
        }
        for (SignalMessage message : replay) {
            deliver(listener, message);
        }
        return () -> listeners.remove(listener);
    }

    public int outboundChannelCount() {
        return outbound.size();
    }

    @Override
    public synchronized void close() {
        closeChannels();
        outbound.close();
        listeners.clear();
        synchronized (dispatchLock) {
            backlog.clear();
        }
        roomId = null;
        log.info("Signaling closed for {}", selfId);
    }

    void dispatch(SignalMessage message) {
        if (message == null || message.getType() == null) {
            return;
        }
        boolean broadcastAnnouncement = message.getType() == SignalType.HOST_ELECTED
                && SignalMessage.BROADCAST.equals(message.getTo());
        if (!selfId.equals(message.getTo()) && !broadcastAnnouncement) {
            return;
        }
        if (selfId.equals(message.getFrom())) {
            return;
        }
        synchronized (dispatchLock) {
            if (listeners.isEmpty()) {
                if (backlog.size() >= MAX_BACKLOG) {
                    SignalMessage dropped = backlog.pollFirst();
                    log.warn("Signal backlog full, dropping {}", dropped);
                }
                backlog.addLast(message);
                return;
            }
        }
        log.debug("Received {} from {}", message.getType().toValue(), message.getFrom());
        for (Consumer<SignalMessage> listener : listeners) {
            deliver(listener, message);
        }
    }

    private void onBusPayload(JsonNode payload) {
        SignalMessage message;
        try {
            message = objectMapper.treeToValue(payload, SignalMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            log.warn("Dropping malformed signal: {}", ex.getMessage());
            return;
        }
        dispatch(message);
    }

    private void deliver(Consumer<SignalMessage> listener, SignalMessage message) {
        try {
            listener.accept(message);
        } catch (RuntimeException ex) {
            log.error("Signal listener failed for {}", message, ex);
        }
    }

    private JsonNode normalizeIce(Object payload) {
        JsonNode source = objectMapper.valueToTree(payload);
        if (source == null || !source.hasNonNull("candidate")) {
            throw new IllegalArgumentException("ICE payload requires a candidate");
        }
        ObjectNode normalized = objectMapper.createObjectNode();
        normalized.put("candidate", source.get("candidate").asText());
        JsonNode index = source.get("sdpMLineIndex");
        if (index == null || index.isNull()) {
            normalized.putNull("sdpMLineIndex");
        } else {
            normalized.put("sdpMLineIndex", index.asInt());
        }
        JsonNode mid = source.get("sdpMid");
        if (mid == null || mid.isNull()) {
            normalized.putNull("sdpMid");
        } else {
            normalized.put("sdpMid", mid.asText());
        }
        return normalized;
    }

    private void closeChannels() {
        if (roomChannel != null) {
            safeUnsubscribe(roomChannel);
            roomChannel = null;
        }
        if (inboxChannel != null) {
            safeUnsubscribe(inboxChannel);
            inboxChannel = null;
        }
    }

    private void safeUnsubscribe(BusChannel channel) {
        try {
            channel.unsubscribe();
        } catch (RuntimeException ex) {
            log.warn("Failed to unsubscribe from {}: {}", channel.getTopic(), ex.getMessage());
        }
    }
}
