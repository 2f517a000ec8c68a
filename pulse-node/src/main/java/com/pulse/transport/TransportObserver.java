package com.pulse.transport;

/**
 * 트랜스포트 세션 이벤트 콜백. 엔진 내부 스레드에서 호출될 수 있다.
 */
public interface TransportObserver {

    void onIceCandidate(IceCandidate candidate);

    void onIceConnectionChange(IceConnectionState state);

    void onDataChannel(DataChannel channel);
}
