package com.pulse.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pulse.bus.BusChannel;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.model.ParticipantRole;
import com.pulse.peer.BroadcastResult;
import com.pulse.peer.ConnectionState;
import com.pulse.peer.PeerMessage;
import com.pulse.peer.PeerPermissionException;
import com.pulse.service.MembershipService;
import com.pulse.service.RoomService;
import com.pulse.support.Eventually;
import com.pulse.support.LoopbackTransportConfig;
import com.pulse.transport.LoopbackTransportEngine;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

@SpringBootTest
@Import(LoopbackTransportConfig.class)
class RoomSessionServiceTest {

    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    @Autowired
    private RoomSessionService sessionService;

    @Autowired
    private RoomService roomService;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private LoopbackTransportEngine engine;

    @Autowired
    private RealtimeBus bus;

    @AfterEach
    void tearDown() {
        sessionService.leaveAll();
        engine.reset();
    }

    @Test
    void creatorBecomesHostAndOwner() {
        RoomConnectionResult result = sessionService.createRoom(ALICE, "Study group", true);

        assertThat(result.isHost()).isTrue();
        assertThat(result.getRole()).isEqualTo(ParticipantRole.HOST);
        assertThat(result.isAutoConnect()).isTrue();
        assertThat(roomService.getRoom(result.getRoomId())).hasValueSatisfying(room -> {
            assertThat(room.getRoomName()).isEqualTo("Study group");
            assertThat(room.getOwner()).isEqualTo(ALICE);
        });
        assertThat(membershipService.getMemberIds(result.getRoomId())).containsExactly(ALICE);
    }

    @Test
    void joinerIsConnectedAutomaticallyAndReceivesBroadcast() {
        String roomId = sessionService.createRoom(ALICE, null, true).getRoomId();

        RoomConnectionResult joined = sessionService.joinExistingRoom(BOB, roomId, null);
        List<PeerMessage> bobInbox = new CopyOnWriteArrayList<>();
        sessionService.onMessage(BOB, roomId, (from, message) -> bobInbox.add(message));

        assertThat(joined.isHost()).isFalse();
        assertThat(joined.getRole()).isEqualTo(ParticipantRole.CLIENT);
        Eventually.await("alice sees bob connected",
                () -> sessionService.getConnectedPeers(ALICE, roomId).contains(BOB));
        Eventually.await("bob sees alice connected",
                () -> sessionService.getConnectedPeers(BOB, roomId).contains(ALICE));

        BroadcastResult result = sessionService.broadcast(ALICE, roomId, PeerMessage.chat("welcome"));

        assertThat(result.getDelivered()).isEqualTo(1);
        Eventually.await("bob received chat", () -> !bobInbox.isEmpty());
        assertThat(bobInbox).containsExactly(PeerMessage.chat("welcome"));
    }

    @Test
    void hostWithoutAutoConnectDialsExplicitly() {
        String roomId = sessionService.createRoom(ALICE, "manual", false).getRoomId();
        sessionService.joinExistingRoom(BOB, roomId, ParticipantRole.CLIENT);

        assertThat(sessionService.getPeerStates(ALICE, roomId)).isEmpty();

        sessionService.connectToPeer(ALICE, roomId, BOB, true);

        assertThat(sessionService.getPeerStates(ALICE, roomId)).containsEntry(BOB, ConnectionState.CONNECTED);
        assertThatThrownBy(() -> sessionService.connectToPeer(BOB, roomId, ALICE, false))
                .isInstanceOf(PeerPermissionException.class);
    }

    @Test
    void joiningTwiceReturnsExistingSession() {
        String roomId = sessionService.createRoom(ALICE, null, true).getRoomId();
        sessionService.joinExistingRoom(BOB, roomId, null);

        RoomConnectionResult again = sessionService.joinExistingRoom(BOB, roomId, null);

        assertThat(again.getRoomId()).isEqualTo(roomId);
        assertThat(sessionService.getSessions()).hasSize(2);
        assertThat(membershipService.getMemberIds(roomId)).containsExactlyInAnyOrder(ALICE, BOB);
    }

    @Test
    void joinerIsPresentBeforeMemberRowAppearsAndSurvivesReconcile() throws InterruptedException {
        String roomId = sessionService.createRoom(ALICE, null, true).getRoomId();
        BusChannel presence = bus.channel(Topics.presence(roomId));
        presence.subscribe(Duration.ofSeconds(1));
        BusChannel members = bus.channel(Topics.members(roomId));
        List<Boolean> presentAtInsert = new CopyOnWriteArrayList<>();
        members.on(Topics.EVENT_INSERT, payload -> {
            if (BOB.equals(payload.get("user_id").asText())) {
                presentAtInsert.add(presence.presenceState().containsKey(BOB));
            }
        });
        members.subscribe(Duration.ofSeconds(1));
        try {
            sessionService.joinExistingRoom(BOB, roomId, null);

            assertThat(presentAtInsert).containsExactly(true);
            Thread.sleep(300);
            assertThat(membershipService.getMemberIds(roomId)).containsExactlyInAnyOrder(ALICE, BOB);
        } finally {
            members.unsubscribe();
            presence.unsubscribe();
        }
    }

    @Test
    void joiningUnknownRoomCreatesItWithJoinerAsHost() {
        String roomId = "room-" + UUID.randomUUID();

        RoomConnectionResult result = sessionService.joinExistingRoom(BOB, roomId, null);

        assertThat(result.isHost()).isTrue();
        assertThat(roomService.getOwner(roomId)).isEqualTo(BOB);
        assertThat(sessionService.getCurrentHost(roomId)).isEqualTo(BOB);
    }

    @Test
    void clientLeavingClosesHostConnection() {
        String roomId = sessionService.createRoom(ALICE, null, true).getRoomId();
        sessionService.joinExistingRoom(BOB, roomId, null);
        Eventually.await("connected", () -> sessionService.getConnectedPeers(ALICE, roomId).contains(BOB));

        assertThat(sessionService.leaveRoom(BOB, roomId)).isTrue();

        Eventually.await("alice dropped bob", () -> !sessionService.getPeerStates(ALICE, roomId).containsKey(BOB));
        assertThat(membershipService.getMemberIds(roomId)).containsExactly(ALICE);
        assertThat(sessionService.getSession(BOB, roomId)).isEmpty();
        assertThat(sessionService.leaveRoom(BOB, roomId)).isFalse();
        assertThat(roomService.getOwner(roomId)).isEqualTo(ALICE);
    }

    @Test
    void hostLeavingPromotesRemainingMember() {
        String roomId = sessionService.createRoom(ALICE, null, true).getRoomId();
        sessionService.joinExistingRoom(BOB, roomId, null);

        sessionService.leaveRoom(ALICE, roomId);

        Eventually.await("bob owns the room", () -> BOB.equals(roomService.getOwner(roomId)));
        RoomSession bob = sessionService.getSession(BOB, roomId).orElseThrow();
        Eventually.await("bob knows he is host", bob::isHost);
        assertThat(membershipService.getMemberIds(roomId)).containsExactly(BOB);
    }

    @Test
    void lastMemberLeavingClearsOwner() {
        String roomId = sessionService.createRoom(ALICE, null, true).getRoomId();

        sessionService.leaveRoom(ALICE, roomId);

        assertThat(roomService.getOwner(roomId)).isNull();
        assertThat(membershipService.getMemberIds(roomId)).isEmpty();
    }

    @Test
    void onlyHostCanTransferHost() {
        String roomId = sessionService.createRoom(ALICE, null, true).getRoomId();
        sessionService.joinExistingRoom(BOB, roomId, null);

        assertThatThrownBy(() -> sessionService.transferHost(BOB, roomId, ALICE))
                .isInstanceOf(PeerPermissionException.class);
        assertThatThrownBy(() -> sessionService.transferHost(ALICE, roomId, ALICE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(sessionService.transferHost(ALICE, roomId, "ghost")).isFalse();

        assertThat(sessionService.transferHost(ALICE, roomId, BOB)).isTrue();

        assertThat(sessionService.getCurrentHost(roomId)).isEqualTo(BOB);
        RoomSession bob = sessionService.getSession(BOB, roomId).orElseThrow();
        RoomSession alice = sessionService.getSession(ALICE, roomId).orElseThrow();
        Eventually.await("host flags updated", () -> bob.isHost() && !alice.isHost());
    }

    @Test
    void operationsOutsideRoomAreRejected() {
        assertThatThrownBy(() -> sessionService.broadcast(ALICE, "nowhere", PeerMessage.chat("hi")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not in room nowhere");
        assertThatThrownBy(() -> sessionService.joinExistingRoom(ALICE, " ", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(sessionService.leaveRoom(ALICE, "nowhere")).isFalse();
    }
}
