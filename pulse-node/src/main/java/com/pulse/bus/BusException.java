package com.pulse.bus;

/**
 * 버스 구독/송신 실패를 표현하는 런타임 예외.
 */
public class BusException extends RuntimeException {

    public BusException(String message) {
        super(message);
    }

    public BusException(String message, Throwable cause) {
        super(message, cause);
    }
}
