package com.pulse.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.bus.RealtimeBus;
import com.pulse.config.PulseProperties;
import com.pulse.election.HostElectionService;
import com.pulse.model.ParticipantRole;
import com.pulse.peer.BroadcastResult;
import com.pulse.peer.ConnectionState;
import com.pulse.peer.PeerConnectionManager;
import com.pulse.peer.PeerMessage;
import com.pulse.peer.PeerMessageCodec;
import com.pulse.peer.PeerPermissionException;
import com.pulse.presence.PresenceReconciler;
import com.pulse.service.MembershipService;
import com.pulse.service.RoomService;
import com.pulse.signaling.HostAnnouncement;
import com.pulse.signaling.SignalMessage;
import com.pulse.signaling.SignalRouter;
import com.pulse.signaling.SignalType;
import com.pulse.signaling.SignalingException;
import com.pulse.support.SessionLoop;
import com.pulse.support.Subscription;
import com.pulse.transport.TransportEngine;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 방 생성/참가/퇴장을 조율한다. 참가자와 방 조합마다 {@link RoomSession}을 하나씩 유지한다.
 */
@Service
public class RoomSessionService {

    private static final Logger log = LoggerFactory.getLogger(RoomSessionService.class);

    private final RoomService roomService;
    private final MembershipService membershipService;
    private final HostElectionService election;
    private final RealtimeBus bus;
    private final TransportEngine transportEngine;
    private final ObjectMapper objectMapper;
    private final PeerMessageCodec codec;
    private final PulseProperties properties;

    private final Map<String, RoomSession> sessions = new ConcurrentHashMap<>();
    private final Set<String> entering = ConcurrentHashMap.newKeySet();

    public RoomSessionService(RoomService roomService, MembershipService membershipService,
            HostElectionService election, RealtimeBus bus, TransportEngine transportEngine, ObjectMapper objectMapper,
            PulseProperties properties) {
        this.roomService = roomService;
        this.membershipService = membershipService;
        this.election = election;
        this.bus = bus;
        this.transportEngine = transportEngine;
        this.objectMapper = objectMapper;
        this.codec = new PeerMessageCodec(objectMapper);
        this.properties = properties;
    }

    /**
     * 새 방을 만들고 호스트로 들어간다.
     *
     * @throws RoomSessionException 방 기록 생성이나 세션 준비가 실패한 경우
     */
    public RoomConnectionResult createRoom(String participantId, String roomName, boolean autoConnect) {
        String selfId = resolve(participantId);
        String roomId = UUID.randomUUID().toString();
        String name = roomName == null || roomName.isBlank() ? "Room " + abbreviate(roomId) : roomName;

        if (!roomService.createRoom(roomId, name, selfId)) {
            throw new RoomSessionException(roomId, "Failed to create room " + roomId);
        }
        log.info("{} created room {} ({})", selfId, roomId, name);
        return enter(selfId, roomId, ParticipantRole.HOST, autoConnect);
    }

    /**
     * 기존 방에 참가한다. 방 기록이 없으면 자신을 owner로 만든다.
     * 자동 연결은 방을 만든 호스트만 사용한다.
     */
    public RoomConnectionResult joinExistingRoom(String participantId, String roomId, ParticipantRole role) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId is required");
        }
        String selfId = resolve(participantId);
        RoomSession existing = sessions.get(RoomSession.key(selfId, roomId));
        if (existing != null) {
            log.info("{} is already in room {}", selfId, roomId);
            return toResult(existing);
        }
        if (!roomService.roomExists(roomId)) {
            if (roomService.createRoom(roomId, "Room " + abbreviate(roomId), selfId)) {
                log.info("Room {} did not exist, created with {} as owner", roomId, selfId);
            }
        }
        return enter(selfId, roomId, role == null ? ParticipantRole.CLIENT : role, false);
    }

    /**
     * 방에서 나간다. presence 해제, 시그널 구독 해제, 모든 피어 연결 종료, 멤버 행 삭제 순서로 진행하며
     * 앞 단계가 실패해도 나머지 단계는 모두 실행한다.
     *
     * @return 세션이 있었으면 true
     * @throws RoomSessionException 하나 이상의 단계가 실패한 경우
     */
    public boolean leaveRoom(String participantId, String roomId) {
        String selfId = resolve(participantId);
        RoomSession session = sessions.remove(RoomSession.key(selfId, roomId));
        if (session == null) {
            return false;
        }
        List<RuntimeException> failures = teardown(session);
        if (!failures.isEmpty()) {
            RoomSessionException summary = new RoomSessionException(roomId,
                    "Leaving room " + roomId + " finished with " + failures.size() + " error(s): "
                            + failures.get(0).getMessage(), failures.get(0));
            for (int i = 1; i < failures.size(); i++) {
                summary.addSuppressed(failures.get(i));
            }
            throw summary;
        }
        log.info("{} left room {}", selfId, roomId);
        return true;
    }

    /**
     * 호스트 권한을 다른 멤버에게 넘긴다. 현재 호스트만 호출할 수 있다.
     *
     * @return 경합에서 지거나 대상이 멤버가 아니면 false
     */
    public boolean transferHost(String participantId, String roomId, String newHostId) {
        RoomSession session = requireSession(participantId, roomId);
        String selfId = session.getParticipantId();
        if (newHostId == null || newHostId.isBlank() || newHostId.equals(selfId)) {
            throw new IllegalArgumentException("Invalid new host: " + newHostId);
        }
        if (!selfId.equals(election.getCurrentHost(roomId))) {
            throw new PeerPermissionException("Only the host can transfer host of room " + roomId);
        }
        return election.transferHost(roomId, selfId, newHostId);
    }

    public void connectToPeer(String participantId, String roomId, String peerId, boolean waitForEstablished) {
        requireSession(participantId, roomId).getConnectionManager().connectToPeer(peerId, waitForEstablished);
    }

    public void send(String participantId, String roomId, String peerId, PeerMessage message) {
        requireSession(participantId, roomId).getConnectionManager().send(peerId, message);
    }

    public BroadcastResult broadcast(String participantId, String roomId, PeerMessage message) {
        return requireSession(participantId, roomId).getConnectionManager().broadcast(message);
    }

    public void onMessage(String participantId, String roomId, BiConsumer<String, PeerMessage> handler) {
        requireSession(participantId, roomId).getConnectionManager().onMessage(handler);
    }

    public Map<String, ConnectionState> getPeerStates(String participantId, String roomId) {
        return requireSession(participantId, roomId).getConnectionManager().getPeerStates();
    }

    public List<String> getConnectedPeers(String participantId, String roomId) {
        return requireSession(participantId, roomId).getConnectionManager().getConnectedPeers();
    }

    public String getCurrentHost(String roomId) {
        return election.getCurrentHost(roomId);
    }

    public Optional<RoomSession> getSession(String participantId, String roomId) {
        return Optional.ofNullable(sessions.get(RoomSession.key(resolve(participantId), roomId)));
    }

    public List<RoomSession> getSessions() {
        return List.copyOf(sessions.values());
    }

    @PreDestroy
    public void leaveAll() {
        for (RoomSession session : getSessions()) {
            try {
                leaveRoom(session.getParticipantId(), session.getRoomId());
            } catch (RuntimeException ex) {
                log.warn("Leaving room {} on shutdown failed: {}", session.getRoomId(), ex.getMessage());
            }
        }
    }

    private RoomConnectionResult enter(String selfId, String roomId, ParticipantRole role, boolean autoConnect) {
        String key = RoomSession.key(selfId, roomId);
        if (!entering.add(key)) {
            throw new IllegalStateException(selfId + " is already entering room " + roomId);
        }
        try {
            RoomSession session = enterSession(selfId, roomId, role, autoConnect);
            sessions.put(key, session);
            RoomConnectionResult result = toResult(session);
            log.info("{} entered room {}: {}", selfId, roomId, result);
            return result;
        } finally {
            entering.remove(key);
        }
    }

    private RoomSession enterSession(String selfId, String roomId, ParticipantRole role, boolean autoConnect) {
        RoomSession session = openSession(selfId, roomId, role, autoConnect);
        try {
            // 수신함을 먼저 열어야 멤버 INSERT를 보고 호스트가 보낸 offer를 놓치지 않는다.
            // presence 항목은 멤버 행보다 먼저 보여야 다른 참가자의 reconcile이 새 행을 지우지 않는다.
            session.getRouter().init(roomId);
            session.getReconciler().join(roomId, role);
            membershipService.addMember(roomId, selfId);
            PeerConnectionManager manager = session.getConnectionManager();
            manager.initialize(roomId, autoConnect);
            if (manager.isHost()) {
                announceHost(session);
            }
            session.setDepartureWatch(election.watchHostDeparture(roomId, session.getLoop()));
        } catch (RuntimeException ex) {
            log.error("{} failed to enter room {}", selfId, roomId, ex);
            teardown(session);
            if (ex instanceof RoomSessionException) {
                throw ex;
            }
            throw new RoomSessionException(roomId, "Failed to enter room " + roomId + ": " + ex.getMessage(), ex);
        }
        return session;
    }

    private RoomSession openSession(String selfId, String roomId, ParticipantRole role, boolean autoConnect) {
        PulseProperties.Bus busConfig = properties.getBus();
        PulseProperties.Signaling signaling = properties.getSignaling();
        SessionLoop loop = new SessionLoop("room-" + abbreviate(roomId) + "-" + abbreviate(selfId));
        SignalRouter router = new SignalRouter(bus, objectMapper, selfId, busConfig.getSubscribeTimeout(),
                signaling.getOutboundIdleTtl(), signaling.getOutboundMaxChannels());
        PresenceReconciler reconciler = new PresenceReconciler(bus, membershipService, loop, selfId,
                properties.getPresence().getSettleDelay(), busConfig.getSubscribeTimeout());
        PeerConnectionManager manager = new PeerConnectionManager(selfId, router, transportEngine, election,
                membershipService, bus, loop, properties.getPeer(), busConfig.getSubscribeTimeout(), codec);
        manager.onMessage((from, message) ->
                log.info("{} received {} from {} in room {}", selfId, message.getClass().getSimpleName(), from,
                        roomId));
        return new RoomSession(selfId, roomId, role, autoConnect, loop, router, reconciler, manager);
    }

    private void announceHost(RoomSession session) {
        HostAnnouncement announcement = new HostAnnouncement(session.getParticipantId(), session.getRoomId(),
                System.currentTimeMillis());
        try {
            session.getRouter().send(SignalMessage.BROADCAST, SignalType.HOST_ELECTED, announcement);
        } catch (SignalingException ex) {
            log.warn("Failed to announce host of room {}: {}", session.getRoomId(), ex.getMessage());
        }
    }

    private List<RuntimeException> teardown(RoomSession session) {
        String selfId = session.getParticipantId();
        String roomId = session.getRoomId();
        List<RuntimeException> failures = new ArrayList<>();
        boolean wasOwner = selfId.equals(election.getCurrentHost(roomId));

        try {
            session.getReconciler().leave();
        } catch (RuntimeException ex) {
            log.warn("Presence leave failed for room {}: {}", roomId, ex.getMessage());
            failures.add(ex);
        }
        try {
            session.getRouter().close();
        } catch (RuntimeException ex) {
            log.warn("Signaling close failed for room {}: {}", roomId, ex.getMessage());
            failures.add(ex);
        }
        try {
            session.getConnectionManager().cleanup();
        } catch (RuntimeException ex) {
            log.warn("Connection cleanup failed for room {}: {}", roomId, ex.getMessage());
            failures.add(ex);
        }
        closeQuietly(session.getDepartureWatch());
        try {
            membershipService.removeMember(roomId, selfId);
            if (wasOwner) {
                election.promoteSuccessor(roomId, selfId);
            }
        } catch (RuntimeException ex) {
            log.warn("Membership removal failed for room {}: {}", roomId, ex.getMessage());
            failures.add(ex);
        }
        session.getLoop().close();
        return failures;
    }

    private RoomSession requireSession(String participantId, String roomId) {
        String selfId = resolve(participantId);
        RoomSession session = sessions.get(RoomSession.key(selfId, roomId));
        if (session == null) {
            throw new IllegalStateException(selfId + " is not in room " + roomId);
        }
        return session;
    }

    private RoomConnectionResult toResult(RoomSession session) {
        return new RoomConnectionResult(session.getRoomId(), session.getParticipantId(), session.getRole(),
                session.isHost(), session.isAutoConnect());
    }

    private String resolve(String participantId) {
        return participantId == null || participantId.isBlank() ? properties.resolveParticipantId() : participantId;
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

    private static String abbreviate(String id) {
        return id.length() <= 8 ? id : id.substring(0, 8);
    }
}
