package com.pulse.session;

import com.pulse.model.ParticipantRole;
import com.pulse.peer.PeerConnectionManager;
import com.pulse.presence.PresenceReconciler;
import com.pulse.signaling.SignalRouter;
import com.pulse.support.SessionLoop;
import com.pulse.support.Subscription;
import java.time.Instant;

/**
 * 참가자 한 명이 방 하나에 들어가 있는 동안 쓰는 구성 요소 묶음.
 */
public class RoomSession {

    private final String participantId;
    private final String roomId;
    private final ParticipantRole role;
    private final boolean autoConnect;
    private final SessionLoop loop;
    private final SignalRouter router;
    private final PresenceReconciler reconciler;
    private final PeerConnectionManager connectionManager;
    private final Instant joinedAt = Instant.now();
    private Subscription departureWatch;

    RoomSession(String participantId, String roomId, ParticipantRole role, boolean autoConnect, SessionLoop loop,
            SignalRouter router, PresenceReconciler reconciler, PeerConnectionManager connectionManager) {
        this.participantId = participantId;
        this.roomId = roomId;
        this.role = role;
        this.autoConnect = autoConnect;
        this.loop = loop;
        this.router = router;
        this.reconciler = reconciler;
        this.connectionManager = connectionManager;
    }

    public String getParticipantId() {
        return participantId;
    }

    public String getRoomId() {
        return roomId;
    }

    public ParticipantRole getRole() {
        return role;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public boolean isHost() {
        return connectionManager.isHost();
    }

    public PeerConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public PresenceReconciler getReconciler() {
        return reconciler;
    }

    SessionLoop getLoop() {
        return loop;
    }

    SignalRouter getRouter() {
        return router;
    }

    Subscription getDepartureWatch() {
        return departureWatch;
    }

    void setDepartureWatch(Subscription departureWatch) {
        this.departureWatch = departureWatch;
    }

    static String key(String participantId, String roomId) {
        return participantId + "@" + roomId;
    }
}
