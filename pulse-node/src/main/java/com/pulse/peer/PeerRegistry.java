package com.pulse.peer;

import com.pulse.transport.IceCandidate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 방 세션 하나에 속한 피어 연결과 대기 중인 ICE 후보를 보관한다.
 */
public class PeerRegistry {

    private final Map<String, PeerConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, List<IceCandidate>> pendingCandidates = new ConcurrentHashMap<>();

    public PeerConnection get(String peerId) {
        return connections.get(peerId);
    }

    PeerConnection put(PeerConnection connection) {
        return connections.put(connection.getPeerId(), connection);
    }

    PeerConnection remove(String peerId) {
        return connections.remove(peerId);
    }

    public Collection<PeerConnection> connections() {
        return List.copyOf(connections.values());
    }

    public int size() {
        return connections.size();
    }

    void enqueueCandidate(String peerId, IceCandidate candidate) {
        pendingCandidates.computeIfAbsent(peerId, key -> new ArrayList<>()).add(candidate);
    }

    /**
     * 대기열을 수신 순서대로 꺼내고 비운다.
     */
    List<IceCandidate> drainCandidates(String peerId) {
        List<IceCandidate> drained = pendingCandidates.remove(peerId);
        return drained == null ? List.of() : drained;
    }

    public List<IceCandidate> pendingCandidates(String peerId) {
        List<IceCandidate> pending = pendingCandidates.get(peerId);
        return pending == null ? List.of() : List.copyOf(pending);
    }

    void discardCandidates(String peerId) {
        pendingCandidates.remove(peerId);
    }

    void clear() {
        connections.clear();
        pendingCandidates.clear();
    }
}
