package com.pulse.bus;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 단일 토픽에 대한 구독 핸들. 브로드캐스트는 보낸 채널 자신에게는 되돌아오지 않는다.
 */
public interface BusChannel {

    String getTopic();

    /**
     * 구독을 시작하고 완료될 때까지 기다린다.
     *
     * @throws BusTimeoutException 제한 시간 안에 구독이 확인되지 않은 경우
     */
    void subscribe(Duration timeout);

    boolean isSubscribed();

    void on(String event, Consumer<JsonNode> handler);

    void onPresence(PresenceListener listener);

    void send(String event, JsonNode payload);

    void track(PresenceEntry entry);

    void untrack();

    /**
     * presence 키(참가자 ID) 기준의 현재 presence 뷰. 구독 전이면 빈 맵이다.
     */
    Map<String, PresenceEntry> presenceState();

    void unsubscribe();
}
