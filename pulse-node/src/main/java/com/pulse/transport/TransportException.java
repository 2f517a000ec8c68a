package com.pulse.transport;

/**
 * 트랜스포트 엔진 호출 실패를 감싸는 런타임 예외.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
