package com.pulse.bus;

public class BusTimeoutException extends BusException {

    public BusTimeoutException(String message) {
        super(message);
    }
}
