package com.pulse.peer;

/**
 * 연결을 기다리는 동안 피어가 failed 또는 closed 상태가 되었을 때 던진다.
 */
public class PeerConnectionFailedException extends RuntimeException {

    public PeerConnectionFailedException(String message) {
        super(message);
    }
}
