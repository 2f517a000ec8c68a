package com.pulse.peer;

/**
 * 연결되지 않았거나 채널이 열려 있지 않은 피어로 보내려 할 때 던진다.
 */
public class PeerNotReadyException extends RuntimeException {

    public PeerNotReadyException(String message) {
        super(message);
    }
}
