package com.pulse.bus;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.support.Eventually;
import com.pulse.support.LoopbackTransportConfig;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * 릴레이 엔드포인트를 띄우고 두 노드의 버스 클라이언트를 붙여 본다.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "pulse.relay.enabled=true",
        "spring.datasource.url=jdbc:h2:mem:relay;MODE=PostgreSQL;DB_CLOSE_DELAY=-1"
})
@Import(LoopbackTransportConfig.class)
class WebSocketRealtimeBusTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(3);

    @LocalServerPort
    private int port;

    @Autowired
    private ObjectMapper objectMapper;

    private WebSocketRealtimeBus nodeA;
    private WebSocketRealtimeBus nodeB;
    private String roomId;

    @BeforeEach
    void setUp() {
        URI relay = URI.create("ws://localhost:" + port + "/bus");
        nodeA = new WebSocketRealtimeBus(new StandardWebSocketClient(), relay, objectMapper, TIMEOUT);
        nodeB = new WebSocketRealtimeBus(new StandardWebSocketClient(), relay, objectMapper, TIMEOUT);
        roomId = UUID.randomUUID().toString();
    }

    @AfterEach
    void tearDown() {
        nodeA.close();
        nodeB.close();
    }

    @Test
    void publishedEventsReachSubscribersOnOtherNode() {
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        BusChannel members = nodeA.channel(Topics.members(roomId));
        members.on(Topics.EVENT_INSERT, received::add);
        members.subscribe(TIMEOUT);

        nodeB.publish(Topics.members(roomId), Topics.EVENT_INSERT,
                objectMapper.createObjectNode().put("room_id", roomId).put("user_id", "bob"));
        nodeB.publish(Topics.members(roomId), Topics.EVENT_DELETE,
                objectMapper.createObjectNode().put("room_id", roomId).put("user_id", "bob"));

        Eventually.await("insert delivered", () -> received.size() == 1);
        assertThat(received.get(0).get("user_id").asText()).isEqualTo("bob");
    }

    @Test
    void channelDoesNotReceiveItsOwnBroadcast() {
        List<JsonNode> onA = new CopyOnWriteArrayList<>();
        List<JsonNode> onB = new CopyOnWriteArrayList<>();
        BusChannel a = nodeA.channel(Topics.room(roomId));
        a.on(Topics.EVENT_HOST_UPDATE, onA::add);
        a.subscribe(TIMEOUT);
        BusChannel b = nodeB.channel(Topics.room(roomId));
        b.on(Topics.EVENT_HOST_UPDATE, onB::add);
        b.subscribe(TIMEOUT);

        a.send(Topics.EVENT_HOST_UPDATE, objectMapper.createObjectNode().put("hostId", "alice"));

        Eventually.await("broadcast delivered", () -> onB.size() == 1);
        assertThat(onA).isEmpty();
    }

    @Test
    void presenceIsSharedAcrossNodes() {
        List<String> left = new CopyOnWriteArrayList<>();
        BusChannel alice = nodeA.channel(Topics.presence(roomId));
        alice.subscribe(TIMEOUT);
        alice.track(new PresenceEntry("alice", "host"));

        BusChannel bob = nodeB.channel(Topics.presence(roomId));
        bob.onPresence(new PresenceListener() {
            @Override
            public void onLeave(String key, PresenceEntry entry) {
                left.add(key);
            }
        });
        bob.subscribe(TIMEOUT);

        Eventually.await("alice visible", () -> bob.presenceState().containsKey("alice"));
        assertThat(bob.presenceState().get("alice").getRole()).isEqualTo("host");

        alice.untrack();

        Eventually.await("leave observed", () -> left.contains("alice"));
        assertThat(bob.presenceState()).isEmpty();
    }

    @Test
    void droppedRelayConnectionIsRestoredWithSubscriptionsAndPresence() throws Exception {
        List<JsonNode> signals = new CopyOnWriteArrayList<>();
        BusChannel inbox = nodeA.channel(Topics.inbox("alice"));
        inbox.on(Topics.EVENT_SIGNAL, signals::add);
        inbox.subscribe(TIMEOUT);
        BusChannel alice = nodeA.channel(Topics.presence(roomId));
        alice.subscribe(TIMEOUT);
        alice.track(new PresenceEntry("alice", "host"));
        BusChannel bob = nodeB.channel(Topics.presence(roomId));
        bob.subscribe(TIMEOUT);
        Eventually.await("alice visible", () -> bob.presenceState().containsKey("alice"));
        WebSocketSession dropped = nodeA.currentSession();

        dropped.close(CloseStatus.SERVER_ERROR);

        Eventually.await("relay connection restored", () -> {
            WebSocketSession current = nodeA.currentSession();
            return current != null && current != dropped && current.isOpen()
                    && inbox.isSubscribed() && alice.isSubscribed();
        });
        Eventually.await("alice visible again", () -> bob.presenceState().containsKey("alice"));

        nodeB.publish(Topics.inbox("alice"), Topics.EVENT_SIGNAL,
                objectMapper.createObjectNode().put("type", "offer"));

        Eventually.await("signal delivered after reconnect", () -> signals.size() == 1);
        assertThat(signals.get(0).get("type").asText()).isEqualTo("offer");
    }

    @Test
    void closingConnectionRemovesPresence() {
        List<String> left = new CopyOnWriteArrayList<>();
        BusChannel alice = nodeA.channel(Topics.presence(roomId));
        alice.subscribe(TIMEOUT);
        alice.track(new PresenceEntry("alice", "client"));
        BusChannel bob = nodeB.channel(Topics.presence(roomId));
        bob.onPresence(new PresenceListener() {
            @Override
            public void onLeave(String key, PresenceEntry entry) {
                left.add(key);
            }
        });
        bob.subscribe(TIMEOUT);
        Eventually.await("alice visible", () -> bob.presenceState().containsKey("alice"));

        nodeA.close();

        Eventually.await("leave observed", () -> left.contains("alice"));
    }
}
