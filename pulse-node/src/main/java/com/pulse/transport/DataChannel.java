package com.pulse.transport;

/**
 * 피어 간 신뢰성 있는 순서 보장 메시지 채널.
 */
public interface DataChannel {

    String getLabel();

    boolean isOpen();

    /**
     * 텍스트 메시지를 보낸다.
     *
     * @throws TransportException 채널이 열려 있지 않거나 전송에 실패한 경우
     */
    void send(String text);

    void registerObserver(DataChannelObserver observer);

    void close();
}
