package com.pulse.repository;

import java.time.Instant;
import java.util.List;

public interface RoomMemberRepositoryCustom {

    List<String> findUserIdsByRoomId(String roomId);

    /**
     * joinedBefore 이전에 들어온 멤버만 사전순으로 반환한다.
     */
    List<String> findUserIdsByRoomIdJoinedBefore(String roomId, Instant joinedBefore);

    String findFirstUserIdByRoomId(String roomId);

    long countByRoomId(String roomId);

    /**
     * 멤버 행을 한 번의 DELETE 문으로 지운다. 동시에 같은 행을 지우면 한쪽만 1을 받는다.
     */
    long deleteMember(String roomId, String userId);
}
