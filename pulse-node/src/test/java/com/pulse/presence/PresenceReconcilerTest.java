package com.pulse.presence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pulse.bus.BusChannel;
import com.pulse.bus.InMemoryRealtimeBus;
import com.pulse.bus.PresenceEntry;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.model.ParticipantRole;
import com.pulse.service.MembershipService;
import com.pulse.support.SessionLoop;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class PresenceReconcilerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Duration LONG_SETTLE = Duration.ofMinutes(1);
    private static final String ROOM = "room-1";

    private final MembershipService membershipService = mock(MembershipService.class);
    private final SessionLoop loop = new SessionLoop("presence-test");

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void reconcileWithEmptyPresenceViewDeletesNothing() {
        RealtimeBus bus = mock(RealtimeBus.class);
        BusChannel channel = mock(BusChannel.class);
        when(bus.channel(Topics.presence(ROOM))).thenReturn(channel);
        when(channel.presenceState()).thenReturn(Map.of());
        when(membershipService.getMemberIdsJoinedBefore(eq(ROOM), any())).thenReturn(List.of("alice", "ghost-1", "ghost-2"));

        PresenceReconciler reconciler = new PresenceReconciler(bus, membershipService, loop, "alice", LONG_SETTLE,
                TIMEOUT);
        reconciler.join(ROOM, ParticipantRole.CLIENT);

        assertThat(reconciler.reconcile()).isZero();
        verify(membershipService, never()).removeMember(anyString(), anyString());
        verify(channel).track(new PresenceEntry("alice", "client"));
    }

    @Test
    void reconcileRemovesMembersAbsentFromPresenceButNeverSelf() {
        InMemoryRealtimeBus bus = new InMemoryRealtimeBus();
        BusChannel bob = bus.channel(Topics.presence(ROOM));
        bob.subscribe(TIMEOUT);
        bob.track(new PresenceEntry("bob", "client"));
        when(membershipService.getMemberIdsJoinedBefore(eq(ROOM), any())).thenReturn(List.of("alice", "bob", "carol"));
        when(membershipService.removeMember(ROOM, "carol")).thenReturn(true);

        PresenceReconciler reconciler = new PresenceReconciler(bus, membershipService, loop, "alice", LONG_SETTLE,
                TIMEOUT);
        reconciler.join(ROOM, ParticipantRole.HOST);

        assertThat(reconciler.reconcile()).isEqualTo(1);
        verify(membershipService).removeMember(ROOM, "carol");
        verify(membershipService, never()).removeMember(ROOM, "alice");
        verify(membershipService, never()).removeMember(ROOM, "bob");
    }

    @Test
    void membersJoinedWithinSettleDelayAreNotReconciled() {
        InMemoryRealtimeBus bus = new InMemoryRealtimeBus();
        when(membershipService.getMemberIdsJoinedBefore(eq(ROOM), any())).thenReturn(List.of("alice"));

        PresenceReconciler reconciler = new PresenceReconciler(bus, membershipService, loop, "alice", LONG_SETTLE,
                TIMEOUT);
        reconciler.join(ROOM, ParticipantRole.HOST);
        Instant before = Instant.now();

        assertThat(reconciler.reconcile()).isZero();

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(membershipService).getMemberIdsJoinedBefore(eq(ROOM), cutoff.capture());
        assertThat(cutoff.getValue()).isBefore(before.minus(LONG_SETTLE).plusSeconds(1));
        verify(membershipService, never()).removeMember(anyString(), anyString());
    }

    @Test
    void departedParticipantLosesMembership() {
        InMemoryRealtimeBus bus = new InMemoryRealtimeBus();
        PresenceReconciler reconciler = new PresenceReconciler(bus, membershipService, loop, "alice", LONG_SETTLE,
                TIMEOUT);
        reconciler.join(ROOM, ParticipantRole.HOST);

        BusChannel bob = bus.channel(Topics.presence(ROOM));
        bob.subscribe(TIMEOUT);
        bob.track(new PresenceEntry("bob", "client"));
        assertThat(reconciler.presenceState()).containsOnlyKeys("alice", "bob");

        bob.unsubscribe();

        verify(membershipService, timeout(1000)).removeMember(ROOM, "bob");
    }

    @Test
    void scheduledReconcileRunsAfterSettleDelay() {
        InMemoryRealtimeBus bus = new InMemoryRealtimeBus();
        when(membershipService.getMemberIdsJoinedBefore(eq(ROOM), any())).thenReturn(List.of("alice", "stale"));

        PresenceReconciler reconciler = new PresenceReconciler(bus, membershipService, loop, "alice",
                Duration.ofMillis(20), TIMEOUT);
        reconciler.join(ROOM, ParticipantRole.HOST);

        verify(membershipService, timeout(1000)).removeMember(ROOM, "stale");
    }

    @Test
    void leaveRemovesOwnMembershipAndIsIdempotent() {
        InMemoryRealtimeBus bus = new InMemoryRealtimeBus();
        PresenceReconciler reconciler = new PresenceReconciler(bus, membershipService, loop, "alice", LONG_SETTLE,
                TIMEOUT);
        reconciler.join(ROOM, ParticipantRole.CLIENT);

        reconciler.leave();
        reconciler.leave();

        assertThat(reconciler.isJoined()).isFalse();
        verify(membershipService, timeout(1000).atLeastOnce()).removeMember(eq(ROOM), eq("alice"));
        verify(membershipService, never()).getMemberIdsJoinedBefore(any(), any());
    }
}
