package com.pulse.transport;

public interface DataChannelObserver {

    void onOpen();

    void onMessage(String text);

    void onClose();

    void onError(String reason);
}
