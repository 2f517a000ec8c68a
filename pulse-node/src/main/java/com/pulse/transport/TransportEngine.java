package com.pulse.transport;

/**
 * 피어 트랜스포트 세션을 만드는 엔진. 기본 구현은 webrtc-java 기반이다.
 */
public interface TransportEngine {

    TransportSession openSession(String localId, String remoteId, TransportObserver observer);
}
