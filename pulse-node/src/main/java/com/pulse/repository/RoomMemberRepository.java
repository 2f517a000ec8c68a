package com.pulse.repository;

import com.pulse.model.RoomMember;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RoomMemberRepository extends JpaRepository<RoomMember, Long>, RoomMemberRepositoryCustom {

    boolean existsByRoomIdAndUserId(String roomId, String userId);
}
