package com.pulse.peer;

/**
 * 연결 수립이나 협상 단계가 제한 시간을 넘겼을 때 던진다.
 */
public class PeerTimeoutException extends RuntimeException {

    public PeerTimeoutException(String message) {
        super(message);
    }

    public PeerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
