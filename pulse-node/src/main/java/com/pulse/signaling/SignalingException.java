package com.pulse.signaling;

/**
 * 시그널 송신 실패. 라우터는 재시도하지 않고 호출자에게 그대로 넘긴다.
 */
public class SignalingException extends RuntimeException {

    public SignalingException(String message) {
        super(message);
    }

    public SignalingException(String message, Throwable cause) {
        super(message, cause);
    }
}
