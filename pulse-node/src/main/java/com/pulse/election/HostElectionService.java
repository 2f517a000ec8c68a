package com.pulse.election;

import com.fasterxml.jackson.databind.JsonNode;
import com.pulse.bus.BusChannel;
import com.pulse.bus.BusException;
import com.pulse.bus.PresenceEntry;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.config.PulseProperties;
import com.pulse.service.MembershipService;
import com.pulse.service.RoomService;
import com.pulse.support.Subscription;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * 방 호스트 선출. owner 컬럼에 대한 조건부 갱신만으로 단일 호스트를 보장한다.
 */
@Service
public class HostElectionService {

    private static final Logger log = LoggerFactory.getLogger(HostElectionService.class);

    private final RoomService roomService;
    private final MembershipService membershipService;
    private final RealtimeBus bus;
    private final PulseProperties properties;

    public HostElectionService(RoomService roomService, MembershipService membershipService, RealtimeBus bus,
            PulseProperties properties) {
        this.roomService = roomService;
        this.membershipService = membershipService;
        this.bus = bus;
        this.properties = properties;
    }

    /**
     * 기록된 호스트를 반환한다. 방이 없거나 저장소를 읽지 못하면 null.
     */
    public String getCurrentHost(String roomId) {
        try {
            return roomService.getOwner(roomId);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Failed to read host of room {}: {}", roomId, ex.getMessage());
            return null;
        }
    }

    /**
     * candidate를 호스트로 선출하려고 시도한다. 시도 후 candidate가 owner로 기록되어 있을 때만 true.
     */
    public boolean electHost(String roomId, String candidate) {
        return attemptElection(roomId, candidate) == ElectionOutcome.ELECTED;
    }

    /**
     * selfId가 현재 호스트인지 판단한다. 호스트가 없거나 stale이면 스스로 선출을 시도한다.
     * 저장소 쓰기 경로 자체가 실패한 경우에만 presence 기반 결정으로 대체한다.
     */
    public boolean amIHost(String roomId, String selfId) {
        ElectionOutcome outcome = attemptElection(roomId, selfId);
        if (outcome != ElectionOutcome.UNAVAILABLE) {
            log.debug("amIHost({}, {}) = {}", roomId, selfId, outcome);
            return outcome == ElectionOutcome.ELECTED;
        }
        String leader = computeHostFromPresence(roomId);
        log.info("Store unavailable for room {}, presence leader is {}", roomId, leader);
        return selfId.equals(leader);
    }

    /**
     * presence에 있는 참가자 중 사전순으로 가장 작은 ID를 반환한다. presence를 읽지 못하면 null.
     */
    public String computeHostFromPresence(String roomId) {
        PulseProperties.Presence config = properties.getPresence();
        BusChannel probe = bus.channel(Topics.presence(roomId));
        try {
            probe.subscribe(config.getProbeTimeout());
            Thread.sleep(config.getProbeDelay().toMillis());
            Map<String, PresenceEntry> state = probe.presenceState();
            TreeSet<String> present = new TreeSet<>();
            for (Map.Entry<String, PresenceEntry> entry : state.entrySet()) {
                String userId = entry.getValue().getUserId();
                present.add(userId != null ? userId : entry.getKey());
            }
            return present.isEmpty() ? null : present.first();
        } catch (BusException ex) {
            log.warn("Presence probe for room {} failed: {}", roomId, ex.getMessage());
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return null;
        } finally {
            probe.unsubscribe();
        }
    }

    /**
     * from이 현재 호스트이고 to가 멤버일 때만 호스트를 넘긴다. 경합에서 지면 false.
     */
    public boolean transferHost(String roomId, String from, String to) {
        try {
            String current = roomService.getOwner(roomId);
            if (current == null || !current.equals(from)) {
                log.warn("Cannot transfer host of room {}: current host is {}, not {}", roomId, current, from);
                return false;
            }
            if (!membershipService.isMember(roomId, to)) {
                log.warn("Cannot transfer host of room {}: {} is not a member", roomId, to);
                return false;
            }
            boolean transferred = roomService.compareAndSetOwner(roomId, from, to);
            if (transferred) {
                log.info("Host of room {} transferred from {} to {}", roomId, from, to);
            } else {
                log.info("Host transfer in room {} lost a race", roomId);
            }
            return transferred;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Host transfer in room {} failed: {}", roomId, ex.getMessage());
            return false;
        }
    }

    /**
     * 호스트가 떠났을 때 남은 멤버 중 사전순으로 가장 작은 ID를 다음 호스트로 올린다.
     * 남은 멤버가 없으면 owner를 비운다.
     *
     * @return 이번 호출로 owner가 바뀌었으면 true
     */
    public boolean promoteSuccessor(String roomId, String departedHost) {
        try {
            String current = roomService.getOwner(roomId);
            if (current == null || !current.equals(departedHost)) {
                return false;
            }
            String candidate = membershipService.getFirstMemberId(roomId);
            if (candidate == null) {
                boolean cleared = roomService.compareAndSetOwner(roomId, departedHost, null);
                if (cleared) {
                    log.info("No members left in room {}, host cleared", roomId);
                }
                return cleared;
            }
            boolean promoted = roomService.compareAndSetOwner(roomId, departedHost, candidate);
            if (promoted) {
                log.info("Promoted {} to host of room {}", candidate, roomId);
            } else {
                log.debug("Promotion in room {} did not take effect", roomId);
            }
            return promoted;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Host handoff in room {} failed: {}", roomId, ex.getMessage());
            return false;
        }
    }

    /**
     * owner 변경 이벤트를 구독한다. 콜백은 새 owner(또는 null)를 받는다.
     */
    public Subscription listenForHostChanges(String roomId, Consumer<String> callback) {
        BusChannel channel = bus.channel(Topics.roomOwner(roomId));
        channel.on(Topics.EVENT_UPDATE, payload -> callback.accept(textOrNull(payload, "owner")));
        channel.subscribe(properties.getBus().getSubscribeTimeout());
        return channel::unsubscribe;
    }

    /**
     * 멤버 삭제 이벤트를 감시하다가 떠난 사람이 호스트면 후임을 선출한다.
     */
    public Subscription watchHostDeparture(String roomId, Executor executor) {
        BusChannel channel = bus.channel(Topics.members(roomId));
        channel.on(Topics.EVENT_DELETE, payload -> {
            String departed = textOrNull(payload, "user_id");
            if (departed != null) {
                executor.execute(() -> promoteSuccessor(roomId, departed));
            }
        });
        channel.subscribe(properties.getBus().getSubscribeTimeout());
        return channel::unsubscribe;
    }

    ElectionOutcome attemptElection(String roomId, String candidate) {
        String current = null;
        try {
            current = roomService.getOwner(roomId);
            if (candidate.equals(current)) {
                return ElectionOutcome.ELECTED;
            }
            if (current != null) {
                if (membershipService.isMember(roomId, current)) {
                    return ElectionOutcome.NOT_ELECTED;
                }
                log.info("Host {} of room {} is stale, {} attempting reclaim", current, roomId, candidate);
                if (roomService.compareAndSetOwner(roomId, current, candidate)) {
                    log.info("{} reclaimed host of room {}", candidate, roomId);
                    return ElectionOutcome.ELECTED;
                }
                return reread(roomId, candidate);
            }
            if (roomService.claimOwner(roomId, candidate)) {
                log.info("{} elected host of room {}", candidate, roomId);
                return ElectionOutcome.ELECTED;
            }
            if (!roomService.roomExists(roomId)
                    && roomService.createRoom(roomId, "Room " + abbreviate(roomId), candidate)) {
                log.info("{} created room {} and became host", candidate, roomId);
                return ElectionOutcome.ELECTED;
            }
            return reread(roomId, candidate);
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Election write for room {} did not complete: {}", roomId, ex.getMessage());
            try {
                return rereadAfterFailure(roomId, candidate, current);
            } catch (DataAccessException | TransactionException again) {
                log.warn("Room store unavailable for {}: {}", roomId, again.getMessage());
                return ElectionOutcome.UNAVAILABLE;
            }
        }
    }

    private ElectionOutcome reread(String roomId, String candidate) {
        String owner = roomService.getOwner(roomId);
        return candidate.equals(owner) ? ElectionOutcome.ELECTED : ElectionOutcome.NOT_ELECTED;
    }

    /**
     * 쓰기가 거부된 뒤의 재조회. 다른 살아있는 소유자가 보일 때만 패배로 본다.
     * 소유자가 비어 있거나 교체하려던 stale 소유자 그대로면 저장소 결과를 믿을 수 없으므로 UNAVAILABLE.
     */
    private ElectionOutcome rereadAfterFailure(String roomId, String candidate, String staleOwner) {
        String owner = roomService.getOwner(roomId);
        if (candidate.equals(owner)) {
            return ElectionOutcome.ELECTED;
        }
        if (owner == null || owner.equals(staleOwner)) {
            log.warn("Owner of room {} unresolved after failed write, deferring to presence", roomId);
            return ElectionOutcome.UNAVAILABLE;
        }
        return ElectionOutcome.NOT_ELECTED;
    }

    private static String abbreviate(String roomId) {
        return roomId.length() <= 8 ? roomId : roomId.substring(0, 8);
    }

    private static String textOrNull(JsonNode payload, String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    enum ElectionOutcome {
        ELECTED,
        NOT_ELECTED,
        UNAVAILABLE
    }
}
