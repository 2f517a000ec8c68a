package com.pulse.transport;

import java.util.concurrent.CompletableFuture;

/**
 * 원격 피어 하나와의 트랜스포트 세션.
 */
public interface TransportSession {

    DataChannel createDataChannel(String label);

    CompletableFuture<SessionDescription> createOffer();

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    void addIceCandidate(IceCandidate candidate);

    IceConnectionState getIceConnectionState();

    void close();
}
