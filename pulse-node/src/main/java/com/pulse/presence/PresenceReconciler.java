package com.pulse.presence;

import com.pulse.bus.BusChannel;
import com.pulse.bus.PresenceEntry;
import com.pulse.bus.PresenceListener;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.model.ParticipantRole;
import com.pulse.service.MembershipService;
import com.pulse.support.SessionLoop;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 방의 presence에 참여하고, presence와 멤버 테이블의 차이를 정리한다.
 * <p>
 * presence에서 사라진 참가자의 멤버 행은 즉시 지우고, 참여 직후에는 settle 지연 뒤 한 번 전체를 맞춘다.
 */
public class PresenceReconciler {

    private static final Logger log = LoggerFactory.getLogger(PresenceReconciler.class);

    private final RealtimeBus bus;
    private final MembershipService membershipService;
    private final SessionLoop loop;
    private final String selfId;
    private final Duration settleDelay;
    private final Duration subscribeTimeout;

    private BusChannel channel;
    private String roomId;
    private ScheduledFuture<?> pendingReconcile;

    public PresenceReconciler(RealtimeBus bus, MembershipService membershipService, SessionLoop loop,
            String selfId, Duration settleDelay, Duration subscribeTimeout) {
        this.bus = bus;
        this.membershipService = membershipService;
        this.loop = loop;
        this.selfId = selfId;
        this.settleDelay = settleDelay;
        this.subscribeTimeout = subscribeTimeout;
    }

    /**
     * presence 채널에 역할과 함께 참여하고, settle 지연 뒤 reconcile을 예약한다.
     */
    public synchronized void join(String roomId, ParticipantRole role) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId is required");
        }
        if (channel != null) {
            leave();
        }
        BusChannel presence = bus.channel(Topics.presence(roomId));
        presence.onPresence(new PresenceListener() {
            @Override
            public void onLeave(String key, PresenceEntry entry) {
                loop.execute(() -> removeDeparted(roomId, key));
            }
        });
        presence.subscribe(subscribeTimeout);
        try {
            presence.track(new PresenceEntry(selfId, role.toValue()));
        } catch (RuntimeException ex) {
            presence.unsubscribe();
            throw ex;
        }
        this.channel = presence;
        this.roomId = roomId;
        log.info("{} joined presence for room {} as {}", selfId, roomId, role.toValue());

        pendingReconcile = loop.schedule(this::reconcileQuietly, settleDelay);
    }

    /**
     * presence에 없는 참가자의 멤버 행을 지운다. 자기 자신은 지우지 않는다.
     * presence 뷰가 비어 있으면 동기화가 끝나지 않은 것으로 보고 아무것도 하지 않는다.
     * settle 지연보다 최근에 들어온 행은 presence가 아직 도착하지 않았을 수 있으므로 건너뛴다.
     *
     * @return 삭제한 멤버 행 수
     */
    public synchronized int reconcile() {
        if (channel == null) {
            return 0;
        }
        Map<String, PresenceEntry> state = channel.presenceState();
        if (state.isEmpty()) {
            log.info("Skipping reconciliation for room {}: presence view not synced", roomId);
            return 0;
        }
        Set<String> present = new HashSet<>(state.keySet());
        for (PresenceEntry entry : state.values()) {
            if (entry.getUserId() != null) {
                present.add(entry.getUserId());
            }
        }
        int removed = 0;
        Instant settledBefore = Instant.now().minus(settleDelay);
        for (String memberId : membershipService.getMemberIdsJoinedBefore(roomId, settledBefore)) {
            if (present.contains(memberId) || memberId.equals(selfId)) {
                continue;
            }
            try {
                if (membershipService.removeMember(roomId, memberId)) {
                    removed++;
                    log.info("Removed stale member {} from room {}", memberId, roomId);
                }
            } catch (RuntimeException ex) {
                log.warn("Failed to remove stale member {} from room {}: {}", memberId, roomId, ex.getMessage());
            }
        }
        return removed;
    }

    /**
     * presence에서 나가고 자신의 멤버 행을 지운 뒤 구독을 닫는다. 여러 번 호출해도 안전하다.
     */
    public synchronized void leave() {
        if (channel == null) {
            return;
        }
        if (pendingReconcile != null) {
            pendingReconcile.cancel(false);
            pendingReconcile = null;
        }
        BusChannel presence = channel;
        String leftRoom = roomId;
        channel = null;
        roomId = null;
        try {
            presence.untrack();
        } catch (RuntimeException ex) {
            log.warn("Failed to untrack presence in room {}: {}", leftRoom, ex.getMessage());
        }
        try {
            membershipService.removeMember(leftRoom, selfId);
        } finally {
            presence.unsubscribe();
            log.info("{} left presence for room {}", selfId, leftRoom);
        }
    }

    public synchronized boolean isJoined() {
        return channel != null;
    }

    public synchronized Map<String, PresenceEntry> presenceState() {
        return channel == null ? Map.of() : channel.presenceState();
    }

    private void removeDeparted(String departedRoom, String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        try {
            if (membershipService.removeMember(departedRoom, key)) {
                log.info("Removed membership for departed {} in room {}", key, departedRoom);
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to remove membership for departed {}: {}", key, ex.getMessage());
        }
    }

    private void reconcileQuietly() {
        try {
            reconcile();
        } catch (RuntimeException ex) {
            log.warn("Presence reconciliation failed for room {}: {}", roomId, ex.getMessage());
        }
    }
}
