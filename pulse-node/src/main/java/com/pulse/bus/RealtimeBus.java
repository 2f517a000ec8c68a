package com.pulse.bus;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 이름 있는 토픽과 presence 추적을 제공하는 pub/sub 버스.
 */
public interface RealtimeBus {

    /**
     * 토픽에 대한 새 채널 핸들을 만든다. 구독은 {@link BusChannel#subscribe}를 호출해야 시작된다.
     */
    BusChannel channel(String topic);

    /**
     * 구독 없이 토픽의 모든 구독자에게 이벤트를 발행한다.
     */
    void publish(String topic, String event, JsonNode payload);
}
