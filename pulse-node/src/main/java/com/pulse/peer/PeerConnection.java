package com.pulse.peer;

import com.pulse.transport.DataChannel;
import com.pulse.transport.TransportSession;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 원격 참가자 한 명과의 연결 상태. 세션 루프에서만 변경되고, 상태 조회는 다른 스레드에서도 가능하다.
 */
public class PeerConnection {

    private static final Logger log = LoggerFactory.getLogger(PeerConnection.class);

    private final String peerId;
    private final Instant createdAt = Instant.now();
    private volatile ConnectionState state = ConnectionState.IDLE;
    private volatile String lastError;
    private volatile int retryCount;

    private TransportSession session;
    private DataChannel channel;
    private boolean remoteDescriptionSet;
    private boolean iceConnected;
    private boolean channelOpen;
    private boolean connectivityLost;

    public PeerConnection(String peerId, int retryCount) {
        this.peerId = peerId;
        this.retryCount = retryCount;
    }

    /**
     * 전이 표에 따라 상태를 바꾼다. 같은 상태로의 전이는 무시한다.
     *
     * @throws IllegalPeerStateTransitionException 허용되지 않은 전이
     */
    public void transitionTo(ConnectionState target) {
        ConnectionState current = state;
        if (current == target) {
            return;
        }
        if (!current.canTransitionTo(target)) {
            throw new IllegalPeerStateTransitionException(peerId, current, target);
        }
        state = target;
        log.debug("Peer {}: {} -> {}", peerId, current.toValue(), target.toValue());
    }

    public String getPeerId() {
        return peerId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public ConnectionState getState() {
        return state;
    }

    public String getLastError() {
        return lastError;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public int getRetryCount() {
        return retryCount;
    }

    void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    TransportSession getSession() {
        return session;
    }

    void setSession(TransportSession session) {
        this.session = session;
    }

    DataChannel getChannel() {
        return channel;
    }

    void setChannel(DataChannel channel) {
        this.channel = channel;
    }

    boolean isRemoteDescriptionSet() {
        return remoteDescriptionSet;
    }

    void setRemoteDescriptionSet(boolean remoteDescriptionSet) {
        this.remoteDescriptionSet = remoteDescriptionSet;
    }

    boolean isIceConnected() {
        return iceConnected;
    }

    void setIceConnected(boolean iceConnected) {
        this.iceConnected = iceConnected;
    }

    boolean isChannelOpen() {
        return channelOpen;
    }

    void setChannelOpen(boolean channelOpen) {
        this.channelOpen = channelOpen;
    }

    boolean isConnectivityLost() {
        return connectivityLost;
    }

    void setConnectivityLost(boolean connectivityLost) {
        this.connectivityLost = connectivityLost;
    }

    @Override
    public String toString() {
        return "PeerConnection{" + peerId + ", " + state.toValue() + ", retries=" + retryCount + "}";
    }
}
