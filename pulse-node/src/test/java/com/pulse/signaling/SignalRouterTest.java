package com.pulse.signaling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.bus.InMemoryRealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.support.Subscription;
import com.pulse.transport.IceCandidate;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignalRouterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String ROOM = "room-1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InMemoryRealtimeBus bus = new InMemoryRealtimeBus();

    private SignalRouter alice;
    private SignalRouter bob;

    @BeforeEach
    void setUp() {
        alice = newRouter("alice");
        bob = newRouter("bob");
        alice.init(ROOM);
        bob.init(ROOM);
    }

    @AfterEach
    void tearDown() {
        alice.close();
        bob.close();
    }

    @Test
    void deliversAddressedSignalToRecipient() {
        List<SignalMessage> received = new CopyOnWriteArrayList<>();
        bob.onMessage(received::add);

        alice.send("bob", SignalType.OFFER, new SessionDescriptionPayload("offer", "v=0"));

        assertThat(received).hasSize(1);
        SignalMessage message = received.get(0);
        assertThat(message.getFrom()).isEqualTo("alice");
        assertThat(message.getTo()).isEqualTo("bob");
        assertThat(message.getType()).isEqualTo(SignalType.OFFER);
        assertThat(message.getData().get("sdp").asText()).isEqualTo("v=0");
    }

    @Test
    void refusesToSignalSelf() {
        assertThatThrownBy(() -> alice.send("alice", SignalType.OFFER, new SessionDescriptionPayload("offer", "v=0")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(alice.outboundChannelCount()).isZero();
    }

    @Test
    void dropsSignalsAddressedToSomeoneElseOrSentBySelf() {
        List<SignalMessage> received = new CopyOnWriteArrayList<>();
        bob.onMessage(received::add);

        SignalMessage misrouted = new SignalMessage("alice", "carol", SignalType.ANSWER, objectMapper.createObjectNode());
        SignalMessage echoed = new SignalMessage("bob", "bob", SignalType.ANSWER, objectMapper.createObjectNode());
        bus.publish(Topics.inbox("bob"), Topics.EVENT_SIGNAL, objectMapper.valueToTree(misrouted));
        bus.publish(Topics.inbox("bob"), Topics.EVENT_SIGNAL, objectMapper.valueToTree(echoed));

        assertThat(received).isEmpty();
    }

    @Test
    void holdsSignalsUntilFirstListenerRegisters() {
        alice.send("bob", SignalType.OFFER, new SessionDescriptionPayload("offer", "v=0"));
        alice.send("bob", SignalType.ICE, new IceCandidate("candidate:1", "0", 0));

        List<SignalMessage> received = new CopyOnWriteArrayList<>();
        bob.onMessage(received::add);

        assertThat(received).extracting(SignalMessage::getType)
                .containsExactly(SignalType.OFFER, SignalType.ICE);
    }

    @Test
    void normalizesIcePayload() {
        List<SignalMessage> received = new CopyOnWriteArrayList<>();
        bob.onMessage(received::add);

        alice.send("bob", SignalType.ICE, new IceCandidate("candidate:9 1 udp 1 10.0.0.1 5000 typ host", "audio", 1));

        assertThat(received).hasSize(1);
        assertThat(received.get(0).getData().get("candidate").asText()).startsWith("candidate:9");
        assertThat(received.get(0).getData().get("sdpMid").asText()).isEqualTo("audio");
        assertThat(received.get(0).getData().get("sdpMLineIndex").asInt()).isEqualTo(1);
    }

    @Test
    void hostAnnouncementReachesOtherRoomMembers() {
        List<SignalMessage> receivedByBob = new CopyOnWriteArrayList<>();
        List<SignalMessage> receivedByAlice = new CopyOnWriteArrayList<>();
        bob.onMessage(receivedByBob::add);
        alice.onMessage(receivedByAlice::add);

        alice.send(SignalMessage.BROADCAST, SignalType.HOST_ELECTED, new HostAnnouncement("alice", ROOM, 1L));

        assertThat(receivedByAlice).isEmpty();
        assertThat(receivedByBob).hasSize(1);
        assertThat(receivedByBob.get(0).getTo()).isEqualTo(SignalMessage.BROADCAST);
        assertThat(receivedByBob.get(0).getData().get("userId").asText()).isEqualTo("alice");
    }

    @Test
    void reusesOutboundChannelPerRecipient() {
        alice.send("bob", SignalType.OFFER, new SessionDescriptionPayload("offer", "v=0"));
        alice.send("bob", SignalType.ICE, new IceCandidate("candidate:1", "0", 0));

        assertThat(alice.outboundChannelCount()).isEqualTo(1);

        alice.close();

        assertThat(alice.outboundChannelCount()).isZero();
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        List<SignalMessage> received = new CopyOnWriteArrayList<>();
        Subscription subscription = bob.onMessage(received::add);
        bob.onMessage(message -> {
        });

        subscription.close();
        alice.send("bob", SignalType.OFFER, new SessionDescriptionPayload("offer", "v=0"));

        assertThat(received).isEmpty();
    }

    private SignalRouter newRouter(String selfId) {
        return new SignalRouter(bus, objectMapper, selfId, TIMEOUT, Duration.ofMinutes(1), 8);
    }
}
