package com.pulse.peer;

/**
 * 호스트만 할 수 있는 작업을 호스트가 아닌 참가자가 시도했을 때 던진다.
 */
public class PeerPermissionException extends RuntimeException {

    public PeerPermissionException(String message) {
        super(message);
    }
}
