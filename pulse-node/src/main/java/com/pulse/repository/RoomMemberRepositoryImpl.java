package com.pulse.repository;

import com.pulse.model.QRoomMember;
import com.querydsl.jpa.impl.JPAQueryFactory;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Transactional(readOnly = true)
public class RoomMemberRepositoryImpl implements RoomMemberRepositoryCustom {

    private final JPAQueryFactory queryFactory;

    public RoomMemberRepositoryImpl(JPAQueryFactory queryFactory) {
        this.queryFactory = queryFactory;
    }

    @Override
    public List<String> findUserIdsByRoomId(String roomId) {
        QRoomMember member = QRoomMember.roomMember;
        return queryFactory.select(member.userId)
                .from(member)
                .where(member.roomId.eq(roomId))
                .orderBy(member.userId.asc())
                .fetch();
    }

    @Override
    public List<String> findUserIdsByRoomIdJoinedBefore(String roomId, Instant joinedBefore) {
        QRoomMember member = QRoomMember.roomMember;
        return queryFactory.select(member.userId)
                .from(member)
                .where(member.roomId.eq(roomId), member.joinedAt.before(joinedBefore))
                .orderBy(member.userId.asc())
                .fetch();
    }

    @Override
    public String findFirstUserIdByRoomId(String roomId) {
        QRoomMember member = QRoomMember.roomMember;
        return queryFactory.select(member.userId)
                .from(member)
                .where(member.roomId.eq(roomId))
                .orderBy(member.userId.asc())
                .limit(1)
                .fetchFirst();
    }

    @Override
    public long countByRoomId(String roomId) {
        QRoomMember member = QRoomMember.roomMember;
        Long count = queryFactory.select(member.id.count())
                .from(member)
                .where(member.roomId.eq(roomId))
                .fetchOne();
        return count == null ? 0L : count;
    }

    @Override
    @Transactional
    public long deleteMember(String roomId, String userId) {
        QRoomMember member = QRoomMember.roomMember;
        return queryFactory.delete(member)
                .where(member.roomId.eq(roomId), member.userId.eq(userId))
                .execute();
    }
}
