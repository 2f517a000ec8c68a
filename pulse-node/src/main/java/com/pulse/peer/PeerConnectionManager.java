package com.pulse.peer;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulse.bus.BusChannel;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.config.PulseProperties;
import com.pulse.election.HostElectionService;
import com.pulse.service.MembershipService;
import com.pulse.signaling.SessionDescriptionPayload;
import com.pulse.signaling.SignalMessage;
import com.pulse.signaling.SignalRouter;
import com.pulse.signaling.SignalType;
import com.pulse.signaling.SignalingException;
import com.pulse.support.SessionLoop;
import com.pulse.support.Subscription;
import com.pulse.transport.DataChannel;
import com.pulse.transport.DataChannelObserver;
import com.pulse.transport.IceCandidate;
import com.pulse.transport.IceConnectionState;
import com.pulse.transport.SessionDescription;
import com.pulse.transport.TransportEngine;
import com.pulse.transport.TransportException;
import com.pulse.transport.TransportObserver;
import com.pulse.transport.TransportSession;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 방 세션 하나의 피어 연결 수명 주기를 관리한다.
 * <p>
 * 호스트만 다이얼하고, 나머지 참가자는 호스트의 offer에 응답한다. 모든 상태 변경은
 * {@link SessionLoop} 위에서 일어나며, 외부 콜백(시그널, 트랜스포트, 버스)은 루프로 넘겨 처리한다.
 */
public class PeerConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(PeerConnectionManager.class);

    static final String DATA_CHANNEL_LABEL = "data";
    private static final long POLL_INTERVAL_MS = 100;

    private final String selfId;
    private final SignalRouter router;
    private final TransportEngine engine;
    private final HostElectionService election;
    private final MembershipService membershipService;
    private final RealtimeBus bus;
    private final SessionLoop loop;
    private final PulseProperties.Peer config;
    private final Duration subscribeTimeout;
    private final PeerMessageCodec codec;
    private final PeerRegistry registry = new PeerRegistry();

    // 아래 필드는 루프 스레드에서만 변경한다.
    private String roomId;
    private boolean autoConnect;
    private volatile boolean host;
    private volatile String currentHostId;
    private Subscription hostSubscription;
    private Subscription signalSubscription;
    private BusChannel memberChannel;
    private volatile BiConsumer<String, PeerMessage> messageHandler;

    public PeerConnectionManager(String selfId, SignalRouter router, TransportEngine engine,
            HostElectionService election, MembershipService membershipService, RealtimeBus bus,
            SessionLoop loop, PulseProperties.Peer config, Duration subscribeTimeout, PeerMessageCodec codec) {
        this.selfId = selfId;
        this.router = router;
        this.engine = engine;
        this.election = election;
        this.membershipService = membershipService;
        this.bus = bus;
        this.loop = loop;
        this.config = config;
        this.subscribeTimeout = subscribeTimeout;
        this.codec = codec;
    }

    /**
     * 방에 연결한다. 호스트 여부를 확인하고 호스트 변경, 멤버 변경, 시그널 수신을 구독한다.
     */
    public void initialize(String roomId, boolean autoConnect) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId is required");
        }
        loop.run(() -> {
            if (this.roomId != null) {
                cleanupInLoop();
            }
            this.roomId = roomId;
            this.autoConnect = autoConnect;
            try {
                host = election.amIHost(roomId, selfId);
                currentHostId = election.getCurrentHost(roomId);
                log.info("{} is {} in room {} (auto-connect: {})", selfId, host ? "HOST" : "CLIENT", roomId,
                        autoConnect);

                hostSubscription = election.listenForHostChanges(roomId,
                        owner -> loop.execute(() -> onHostChanged(roomId, owner)));

                BusChannel members = bus.channel(Topics.members(roomId));
                members.on(Topics.EVENT_INSERT,
                        payload -> loop.execute(() -> onMemberJoined(roomId, textOrNull(payload, "user_id"))));
                members.on(Topics.EVENT_DELETE,
                        payload -> loop.execute(() -> onMemberLeft(roomId, textOrNull(payload, "user_id"))));
                members.subscribe(subscribeTimeout);
                memberChannel = members;

                signalSubscription = router.onMessage(message -> loop.execute(() -> handleSignal(message)));
            } catch (RuntimeException ex) {
                cleanupInLoop();
                throw ex;
            }
        });
    }

    /**
     * 피어에게 다이얼한다. 호스트만 가능하며 이미 연결 중이거나 연결된 피어에는 아무것도 하지 않는다.
     *
     * @throws PeerPermissionException 호스트가 아닌 경우
     * @throws PeerTimeoutException waitForEstablished가 true이고 제한 시간 안에 연결되지 않은 경우
     * @throws PeerConnectionFailedException 기다리는 동안 연결이 실패한 경우
     */
    public void connectToPeer(String peerId, boolean waitForEstablished) {
        loop.run(() -> dial(peerId));
        if (waitForEstablished) {
            awaitEstablished(peerId, config.getEstablishTimeout());
        }
    }

    /**
     * 피어가 connected가 될 때까지 호출 스레드에서 폴링한다.
     */
    public void awaitEstablished(String peerId, Duration timeout) {
        if (loop.inLoop()) {
            throw new IllegalStateException("awaitEstablished must not block the session loop");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            PeerConnection connection = registry.get(peerId);
            ConnectionState state = connection == null ? null : connection.getState();
            if (state == ConnectionState.CONNECTED) {
                return;
            }
            if (state == null || state == ConnectionState.CLOSED) {
                throw new PeerConnectionFailedException("Connection to " + peerId + " was closed");
            }
            if (state == ConnectionState.FAILED) {
                throw new PeerConnectionFailedException(
                        "Connection to " + peerId + " failed: " + connection.getLastError());
            }
            if (System.nanoTime() >= deadline) {
                throw new PeerTimeoutException(
                        "Connection to " + peerId + " not established within " + timeout.toSeconds() + "s");
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new PeerTimeoutException("Interrupted while waiting for " + peerId, ex);
            }
        }
    }

    /**
     * @throws PeerNotReadyException 연결되지 않았거나 채널이 닫힌 경우
     */
    public void send(String peerId, PeerMessage message) {
        String frame = codec.encode(message);
        loop.run(() -> {
            PeerConnection connection = registry.get(peerId);
            if (connection == null || connection.getState() != ConnectionState.CONNECTED) {
                String state = connection == null ? "unknown" : connection.getState().toValue();
                throw new PeerNotReadyException("Peer " + peerId + " is not connected (" + state + ")");
            }
            DataChannel channel = connection.getChannel();
            if (channel == null || !channel.isOpen()) {
                throw new PeerNotReadyException("Data channel to " + peerId + " is not open");
            }
            try {
                channel.send(frame);
            } catch (TransportException ex) {
                connection.setLastError(ex.getMessage());
                throw ex;
            }
        });
    }

    /**
     * connected 상태인 모든 피어에게 보낸다. 일부 피어 실패는 결과에 모으고 나머지 전송은 계속한다.
     */
    public BroadcastResult broadcast(PeerMessage message) {
        String frame = codec.encode(message);
        return loop.call(() -> {
            int delivered = 0;
            int attempted = 0;
            Map<String, String> errors = new LinkedHashMap<>();
            for (PeerConnection connection : registry.connections()) {
                if (connection.getState() != ConnectionState.CONNECTED) {
                    continue;
                }
                attempted++;
                DataChannel channel = connection.getChannel();
                if (channel == null || !channel.isOpen()) {
                    String reason = "Data channel not open";
                    connection.setLastError(reason);
                    errors.put(connection.getPeerId(), reason);
                    continue;
                }
                try {
                    channel.send(frame);
                    delivered++;
                } catch (TransportException ex) {
                    connection.setLastError(ex.getMessage());
                    errors.put(connection.getPeerId(), ex.getMessage());
                }
            }
            if (!errors.isEmpty()) {
                log.warn("Broadcast reached {}/{} peers, failed: {}", delivered, attempted, errors.keySet());
            }
            return new BroadcastResult(delivered, attempted, errors);
        });
    }

    public boolean closePeer(String peerId) {
        return loop.call(() -> closePeerInLoop(peerId));
    }

    /**
     * 모든 연결을 닫고 모든 구독을 해제한다.
     */
    public void cleanup() {
        loop.run(this::cleanupInLoop);
    }

    public ConnectionState getPeerState(String peerId) {
        PeerConnection connection = registry.get(peerId);
        return connection == null ? null : connection.getState();
    }

    public String getLastError(String peerId) {
        PeerConnection connection = registry.get(peerId);
        return connection == null ? null : connection.getLastError();
    }

    public List<String> getConnectedPeers() {
        return registry.connections().stream()
                .filter(connection -> connection.getState() == ConnectionState.CONNECTED)
                .map(PeerConnection::getPeerId)
                .sorted()
                .toList();
    }

    public Map<String, ConnectionState> getPeerStates() {
        Map<String, ConnectionState> states = new LinkedHashMap<>();
        registry.connections().stream()
                .sorted((a, b) -> a.getPeerId().compareTo(b.getPeerId()))
                .forEach(connection -> states.put(connection.getPeerId(), connection.getState()));
        return states;
    }

    /**
     * 애플리케이션 메시지 핸들러를 지정한다. ping은 여기로 오지 않고 자동으로 pong 응답한다.
     */
    public void onMessage(BiConsumer<String, PeerMessage> handler) {
        this.messageHandler = handler;
    }

    public boolean isHost() {
        return host;
    }

    public String getCurrentHostId() {
        return currentHostId;
    }

    public PeerRegistry getRegistry() {
        return registry;
    }

    // ---------------------------------------------------------------- 다이얼

    private void dial(String peerId) {
        if (roomId == null) {
            throw new IllegalStateException("Connection manager is not attached to a room");
        }
        if (peerId == null || peerId.isBlank() || peerId.equals(selfId)) {
            throw new IllegalArgumentException("Invalid peer id: " + peerId);
        }
        if (!host) {
            throw new PeerPermissionException("Only the host can initiate connections (room " + roomId + ")");
        }
        PeerConnection existing = registry.get(peerId);
        if (existing != null && existing.getState().isActive()) {
            log.debug("Already {} with {}, skipping dial", existing.getState().toValue(), peerId);
            return;
        }
        startOffer(peerId, 0, existing);
    }

    private void startOffer(String peerId, int retryCount, PeerConnection replaced) {
        PeerConnection connection = new PeerConnection(peerId, retryCount);
        registry.put(connection);
        if (replaced != null) {
            retire(replaced);
        }
        connection.transitionTo(ConnectionState.OFFERING);
        log.info("Dialing {} (attempt {})", peerId, retryCount + 1);
        try {
            TransportSession session = engine.openSession(selfId, peerId, observerFor(connection));
            connection.setSession(session);
            attachChannel(connection, session.createDataChannel(DATA_CHANNEL_LABEL));

            SessionDescription offer = await(session.createOffer(), "create offer for " + peerId);
            await(session.setLocalDescription(offer), "apply local offer for " + peerId);
            log.debug("Local offer for {}: {}", peerId, offer.getSdp());
            router.send(peerId, SignalType.OFFER, new SessionDescriptionPayload("offer", offer.getSdp()));
            connection.transitionTo(ConnectionState.CONNECTING);
        } catch (TransportException | SignalingException | PeerTimeoutException ex) {
            fail(connection, "Offer to " + peerId + " failed: " + ex.getMessage());
            throw ex;
        }
    }

    private void retry(String peerId, PeerConnection previous, int attempt) {
        if (registry.get(peerId) != previous) {
            return;
        }
        if (!host) {
            log.info("No longer host, not redialing {}", peerId);
            return;
        }
        try {
            startOffer(peerId, attempt, previous);
        } catch (RuntimeException ex) {
            log.warn("Redial of {} failed: {}", peerId, ex.getMessage());
        }
    }

    // ---------------------------------------------------------------- 시그널 처리

    private void handleSignal(SignalMessage message) {
        if (roomId == null) {
            return;
        }
        String from = message.getFrom();
        try {
            switch (message.getType()) {
                case OFFER -> handleOffer(from, message.getData());
                case ANSWER -> handleAnswer(from, message.getData());
                case ICE -> handleRemoteIce(from, message.getData());
                case HOST_ELECTED -> handleHostAnnouncement(message.getData());
                default -> log.debug("Ignoring signal {}", message);
            }
        } catch (RuntimeException ex) {
            log.error("Failed to handle {} from {}", message.getType().toValue(), from, ex);
        }
    }

    private void handleOffer(String from, JsonNode data) {
        if (!admitOffer(from)) {
            log.warn("Rejecting offer from non-host {} (host is {})", from, currentHostId);
            return;
        }
        PeerConnection existing = registry.get(from);
        if (existing != null && existing.getState().isActive() && !existing.isConnectivityLost()) {
            log.warn("Ignoring duplicate offer from {} while {}", from, existing.getState().toValue());
            return;
        }
        String sdp = requiredText(data, "sdp");

        PeerConnection connection = new PeerConnection(from, existing == null ? 0 : existing.getRetryCount());
        registry.put(connection);
        if (existing != null) {
            retire(existing);
        }
        connection.transitionTo(ConnectionState.ANSWERING);
        try {
            TransportSession session = engine.openSession(selfId, from, observerFor(connection));
            connection.setSession(session);
            await(session.setRemoteDescription(new SessionDescription(SessionDescription.Type.OFFER, sdp)),
                    "apply remote offer from " + from);
            connection.setRemoteDescriptionSet(true);

            SessionDescription answer = await(session.createAnswer(), "create answer for " + from);
            await(session.setLocalDescription(answer), "apply local answer for " + from);
            router.send(from, SignalType.ANSWER, new SessionDescriptionPayload("answer", answer.getSdp()));
            connection.transitionTo(ConnectionState.CONNECTING);
            flushPendingCandidates(connection);
            log.info("Answered offer from {}", from);
        } catch (TransportException | SignalingException | PeerTimeoutException ex) {
            fail(connection, "Answer to " + from + " failed: " + ex.getMessage());
        }
    }

    private void handleAnswer(String from, JsonNode data) {
        PeerConnection connection = registry.get(from);
        if (connection == null || connection.getSession() == null) {
            log.warn("Answer from {} without a pending offer", from);
            return;
        }
        if (connection.isRemoteDescriptionSet()) {
            log.debug("Duplicate answer from {} ignored", from);
            return;
        }
        String sdp = requiredText(data, "sdp");
        try {
            await(connection.getSession().setRemoteDescription(
                    new SessionDescription(SessionDescription.Type.ANSWER, sdp)), "apply remote answer from " + from);
            connection.setRemoteDescriptionSet(true);
            connection.transitionTo(ConnectionState.CONNECTING);
            flushPendingCandidates(connection);
        } catch (TransportException | PeerTimeoutException ex) {
            fail(connection, "Answer from " + from + " rejected: " + ex.getMessage());
        }
    }

    private void handleRemoteIce(String from, JsonNode data) {
        IceCandidate candidate = new IceCandidate(requiredText(data, "candidate"),
                textOrNull(data, "sdpMid"),
                data.hasNonNull("sdpMLineIndex") ? data.get("sdpMLineIndex").asInt() : 0);
        PeerConnection connection = registry.get(from);
        if (connection == null || connection.getSession() == null || !connection.isRemoteDescriptionSet()) {
            registry.enqueueCandidate(from, candidate);
            log.debug("Queued ICE candidate from {}", from);
            return;
        }
        applyCandidate(connection, candidate);
    }

    private void handleHostAnnouncement(JsonNode data) {
        String announced = textOrNull(data, "userId");
        String announcedRoom = textOrNull(data, "roomId");
        if (announced == null || (announcedRoom != null && !announcedRoom.equals(roomId))) {
            return;
        }
        log.info("Host announcement: {} is host of {}", announced, roomId);
        onHostChanged(roomId, announced);
    }

    /**
     * 호스트가 아닌 참가자는 자신이 알고 있는 호스트의 offer만 받는다. 알고 있는 값이 다르면 저장소를 다시 읽는다.
     */
    private boolean admitOffer(String from) {
        if (host || from.equals(currentHostId)) {
            return true;
        }
        String recorded = election.getCurrentHost(roomId);
        if (recorded != null) {
            currentHostId = recorded;
        }
        return from.equals(recorded);
    }

    private void flushPendingCandidates(PeerConnection connection) {
        List<IceCandidate> pending = registry.drainCandidates(connection.getPeerId());
        if (!pending.isEmpty()) {
            log.debug("Applying {} queued ICE candidates for {}", pending.size(), connection.getPeerId());
        }
        for (IceCandidate candidate : pending) {
            applyCandidate(connection, candidate);
        }
    }

    private void applyCandidate(PeerConnection connection, IceCandidate candidate) {
        try {
            connection.getSession().addIceCandidate(candidate);
        } catch (TransportException ex) {
            log.warn("Failed to add ICE candidate for {}: {}", connection.getPeerId(), ex.getMessage());
        }
    }

    // ---------------------------------------------------------------- 트랜스포트 이벤트

    private TransportObserver observerFor(PeerConnection connection) {
        String peerId = connection.getPeerId();
        return new TransportObserver() {
            @Override
            public void onIceCandidate(IceCandidate candidate) {
                loop.execute(() -> {
                    if (!isCurrent(connection)) {
                        return;
                    }
                    try {
                        router.send(peerId, SignalType.ICE, candidate);
                    } catch (SignalingException ex) {
                        log.warn("Failed to send ICE candidate to {}: {}", peerId, ex.getMessage());
                    }
                });
            }

            @Override
            public void onIceConnectionChange(IceConnectionState state) {
                loop.execute(() -> handleIceState(connection, state));
            }

            @Override
            public void onDataChannel(DataChannel channel) {
                loop.execute(() -> {
                    if (!isCurrent(connection)) {
                        channel.close();
                        return;
                    }
                    attachChannel(connection, channel);
                });
            }
        };
    }

    private void attachChannel(PeerConnection connection, DataChannel channel) {
        connection.setChannel(channel);
        channel.registerObserver(new DataChannelObserver() {
            @Override
            public void onOpen() {
                loop.execute(() -> {
                    if (isCurrent(connection)) {
                        connection.setChannelOpen(true);
                        promoteIfReady(connection);
                    }
                });
            }

            @Override
            public void onMessage(String text) {
                loop.execute(() -> {
                    if (isCurrent(connection)) {
                        handleIncoming(connection, text);
                    }
                });
            }

            @Override
            public void onClose() {
                loop.execute(() -> {
                    if (isCurrent(connection)) {
                        log.info("Data channel to {} closed", connection.getPeerId());
                        closePeerInLoop(connection.getPeerId());
                    }
                });
            }

            @Override
            public void onError(String reason) {
                loop.execute(() -> {
                    if (isCurrent(connection)) {
                        fail(connection, "Data channel error: " + reason);
                    }
                });
            }
        });
        if (channel.isOpen()) {
            connection.setChannelOpen(true);
            promoteIfReady(connection);
        }
    }

    private void handleIceState(PeerConnection connection, IceConnectionState state) {
        if (!isCurrent(connection)) {
            return;
        }
        if (state.isConnected()) {
            connection.setIceConnected(true);
            connection.setConnectivityLost(false);
            promoteIfReady(connection);
            return;
        }
        if (state != IceConnectionState.FAILED && state != IceConnectionState.DISCONNECTED) {
            return;
        }
        connection.setIceConnected(false);
        connection.setConnectivityLost(true);
        if (connection.getState().isTerminal()) {
            return;
        }
        String peerId = connection.getPeerId();
        if (connection.getRetryCount() < config.getMaxRetries()) {
            int attempt = connection.getRetryCount() + 1;
            connection.setRetryCount(attempt);
            if (host) {
                log.warn("ICE {} with {}, redialing in {} ms (retry {}/{})", state.name().toLowerCase(), peerId,
                        config.getRetryBackoff().toMillis(), attempt, config.getMaxRetries());
                loop.schedule(() -> retry(peerId, connection, attempt), config.getRetryBackoff());
            } else {
                log.warn("ICE {} with {}, waiting for host to redial", state.name().toLowerCase(), peerId);
            }
            return;
        }
        fail(connection, "ICE connection " + state.name().toLowerCase());
    }

    private void promoteIfReady(PeerConnection connection) {
        if (connection.isIceConnected() && connection.isChannelOpen()
                && connection.getState() == ConnectionState.CONNECTING) {
            connection.transitionTo(ConnectionState.CONNECTED);
            connection.setRetryCount(0);
            connection.setLastError(null);
            log.info("Connected to {}", connection.getPeerId());
        }
    }

    private void handleIncoming(PeerConnection connection, String text) {
        PeerMessage message;
        try {
            message = codec.decode(text);
        } catch (IllegalArgumentException ex) {
            log.warn("Dropping malformed message from {}: {}", connection.getPeerId(), ex.getMessage());
            return;
        }
        message.accept(new InboundDispatcher(connection));
    }

    /**
     * ping에는 바로 pong으로 답하고 나머지는 애플리케이션 핸들러에 넘긴다.
     */
    private final class InboundDispatcher implements PeerMessage.Visitor<Void> {

        private final PeerConnection connection;

        private InboundDispatcher(PeerConnection connection) {
            this.connection = connection;
        }

        @Override
        public Void visitPing(PeerMessage.Ping ping) {
            DataChannel channel = connection.getChannel();
            if (channel != null && channel.isOpen()) {
                try {
                    channel.send(codec.encode(new PeerMessage.Pong(ping.getTimestamp())));
                } catch (TransportException ex) {
                    log.warn("Failed to answer ping from {}: {}", connection.getPeerId(), ex.getMessage());
                }
            }
            return null;
        }

        @Override
        public Void visitPong(PeerMessage.Pong pong) {
            return deliver(pong);
        }

        @Override
        public Void visitChat(PeerMessage.Chat chat) {
            return deliver(chat);
        }

        @Override
        public Void visitState(PeerMessage.StateUpdate state) {
            return deliver(state);
        }

        @Override
        public Void visitControl(PeerMessage.Control control) {
            return deliver(control);
        }

        private Void deliver(PeerMessage message) {
            BiConsumer<String, PeerMessage> handler = messageHandler;
            if (handler == null) {
                return null;
            }
            try {
                handler.accept(connection.getPeerId(), message);
            } catch (RuntimeException ex) {
                log.error("Message handler failed for message from {}", connection.getPeerId(), ex);
            }
            return null;
        }
    }

    // ---------------------------------------------------------------- 호스트/멤버 변경

    private void onHostChanged(String changedRoom, String owner) {
        if (!changedRoom.equals(roomId)) {
            return;
        }
        boolean wasHost = host;
        currentHostId = owner;
        host = selfId.equals(owner);
        if (!wasHost && host) {
            log.info("{} became host of {}, connecting to existing members", selfId, roomId);
            connectToExistingMembers();
        } else if (wasHost && !host) {
            log.info("{} is no longer host of {}", selfId, roomId);
        }
    }

    private void connectToExistingMembers() {
        for (String memberId : membershipService.getMemberIdsExcept(roomId, selfId)) {
            PeerConnection existing = registry.get(memberId);
            if (existing != null && existing.getState().isActive()) {
                continue;
            }
            try {
                dial(memberId);
            } catch (RuntimeException ex) {
                log.warn("Catch-up dial to {} failed: {}", memberId, ex.getMessage());
            }
        }
    }

    private void onMemberJoined(String joinedRoom, String userId) {
        if (!joinedRoom.equals(roomId) || userId == null || userId.equals(selfId)) {
            return;
        }
        if (host && autoConnect) {
            log.info("New member {} joined, auto-connecting", userId);
            try {
                dial(userId);
            } catch (RuntimeException ex) {
                log.warn("Auto-connect to {} failed: {}", userId, ex.getMessage());
            }
        }
    }

    private void onMemberLeft(String leftRoom, String userId) {
        if (!leftRoom.equals(roomId) || userId == null || userId.equals(selfId)) {
            return;
        }
        if (closePeerInLoop(userId)) {
            log.info("Member {} left, connection closed", userId);
        }
    }

    // ---------------------------------------------------------------- 정리

    private boolean closePeerInLoop(String peerId) {
        registry.discardCandidates(peerId);
        PeerConnection connection = registry.remove(peerId);
        if (connection == null) {
            return false;
        }
        retire(connection);
        return true;
    }

    /**
     * 트랜스포트 자원을 닫고 closed로 전이한다. 레지스트리에서 제거하는 것은 호출자의 몫이다.
     */
    private void retire(PeerConnection connection) {
        DataChannel channel = connection.getChannel();
        if (channel != null) {
            try {
                channel.close();
            } catch (RuntimeException ex) {
                log.debug("Error closing data channel to {}: {}", connection.getPeerId(), ex.getMessage());
            }
        }
        TransportSession session = connection.getSession();
        if (session != null) {
            try {
                session.close();
            } catch (RuntimeException ex) {
                log.debug("Error closing session with {}: {}", connection.getPeerId(), ex.getMessage());
            }
        }
        connection.transitionTo(ConnectionState.CLOSED);
    }

    private void fail(PeerConnection connection, String cause) {
        connection.setLastError(cause);
        if (!connection.getState().isTerminal()) {
            connection.transitionTo(ConnectionState.FAILED);
        }
        log.warn("Peer {} failed: {}", connection.getPeerId(), cause);
    }

    private void cleanupInLoop() {
        closeQuietly(signalSubscription);
        signalSubscription = null;
        closeQuietly(hostSubscription);
        hostSubscription = null;
        if (memberChannel != null) {
            try {
                memberChannel.unsubscribe();
            } catch (RuntimeException ex) {
                log.warn("Failed to unsubscribe member feed: {}", ex.getMessage());
            }
            memberChannel = null;
        }
        for (PeerConnection connection : registry.connections()) {
            closePeerInLoop(connection.getPeerId());
        }
        registry.clear();
        if (roomId != null) {
            log.info("Connection manager for {} cleaned up in room {}", selfId, roomId);
        }
        roomId = null;
        host = false;
        currentHostId = null;
    }

    private boolean isCurrent(PeerConnection connection) {
        return registry.get(connection.getPeerId()) == connection;
    }

    private <T> T await(CompletableFuture<T> future, String step) {
        try {
            return future.get(config.getNegotiationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new PeerTimeoutException("Timed out trying to " + step);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PeerTimeoutException("Interrupted trying to " + step, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof TransportException) {
                throw (TransportException) cause;
            }
            throw new TransportException("Failed to " + step, cause);
        }
    }

    private static void closeQuietly(Subscription subscription) {
        if (subscription == null) {
            return;
        }
        try {
            subscription.close();
        } catch (RuntimeException ex) {
            log.warn("Failed to close subscription: {}", ex.getMessage());
        }
    }

    private static String requiredText(JsonNode data, String field) {
        String value = textOrNull(data, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private static String textOrNull(JsonNode data, String field) {
        JsonNode node = data == null ? null : data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
