package com.pulse.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pulse.bus.RealtimeBus;
import com.pulse.bus.Topics;
import com.pulse.model.RoomMember;
import com.pulse.repository.RoomMemberRepository;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * room_members 테이블을 관리하고 INSERT/DELETE 변경 피드를 발행한다.
 */
@Service
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    private final RoomMemberRepository memberRepository;
    private final RealtimeBus bus;
    private final ObjectMapper objectMapper;

    public MembershipService(RoomMemberRepository memberRepository, RealtimeBus bus, ObjectMapper objectMapper) {
        this.memberRepository = memberRepository;
        this.bus = bus;
        this.objectMapper = objectMapper;
    }

    /**
     * 멤버 행을 추가한다. 이미 있으면 아무것도 하지 않고 false를 반환한다.
     */
    public boolean addMember(String roomId, String userId) {
        if (memberRepository.existsByRoomIdAndUserId(roomId, userId)) {
            return false;
        }
        try {
            memberRepository.saveAndFlush(new RoomMember(roomId, userId, Instant.now()));
        } catch (DataIntegrityViolationException ex) {
            log.debug("Member {} already in room {}", userId, roomId);
            return false;
        }
        log.info("Member {} joined room {}", userId, roomId);
        publish(roomId, userId, Topics.EVENT_INSERT);
        return true;
    }

    /**
     * 멤버 행을 삭제한다. 실제로 지웠을 때만 DELETE 이벤트를 발행한다.
     */
    public boolean removeMember(String roomId, String userId) {
        boolean removed = memberRepository.deleteMember(roomId, userId) > 0;
        if (removed) {
            log.info("Member {} removed from room {}", userId, roomId);
            publish(roomId, userId, Topics.EVENT_DELETE);
        }
        return removed;
    }

    public boolean isMember(String roomId, String userId) {
        return memberRepository.existsByRoomIdAndUserId(roomId, userId);
    }

    /**
     * 방의 멤버 ID를 사전순으로 반환한다.
     */
    public List<String> getMemberIds(String roomId) {
        return memberRepository.findUserIdsByRoomId(roomId);
    }

    /**
     * joinedBefore 이전에 들어온 멤버 ID만 반환한다. 막 들어와 presence가 아직 퍼지지 않은 행을 거를 때 쓴다.
     */
    public List<String> getMemberIdsJoinedBefore(String roomId, Instant joinedBefore) {
        return memberRepository.findUserIdsByRoomIdJoinedBefore(roomId, joinedBefore);
    }

    public List<String> getMemberIdsExcept(String roomId, String excludedUserId) {
        return getMemberIds(roomId).stream()
                .filter(userId -> !userId.equals(excludedUserId))
                .toList();
    }

    /**
     * 사전순으로 가장 작은 멤버 ID. 멤버가 없으면 null.
     */
    public String getFirstMemberId(String roomId) {
        return memberRepository.findFirstUserIdByRoomId(roomId);
    }

    public long countMembers(String roomId) {
        return memberRepository.countByRoomId(roomId);
    }

    private void publish(String roomId, String userId, String event) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("room_id", roomId);
        payload.put("user_id", userId);
        bus.publish(Topics.members(roomId), event, payload);
    }
}
