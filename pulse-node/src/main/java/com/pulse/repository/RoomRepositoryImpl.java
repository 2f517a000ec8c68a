package com.pulse.repository;

import com.pulse.model.QRoom;
import com.querydsl.jpa.impl.JPAQueryFactory;
import com.querydsl.jpa.impl.JPAUpdateClause;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class RoomRepositoryImpl implements RoomRepositoryCustom {

    private final JPAQueryFactory queryFactory;

    public RoomRepositoryImpl(JPAQueryFactory queryFactory) {
        this.queryFactory = queryFactory;
    }

    @Override
    @Transactional(readOnly = true)
    public String findOwnerById(String roomId) {
        QRoom room = QRoom.room;
        return queryFactory.select(room.owner)
                .from(room)
                .where(room.id.eq(roomId))
                .fetchOne();
    }

    @Override
    @Transactional
    public long claimOwner(String roomId, String candidate) {
        QRoom room = QRoom.room;
        return queryFactory.update(room)
                .set(room.owner, candidate)
                .where(room.id.eq(roomId), room.owner.isNull())
                .execute();
    }

    @Override
    @Transactional
    public long compareAndSetOwner(String roomId, String expected, String candidate) {
        QRoom room = QRoom.room;
        JPAUpdateClause update = queryFactory.update(room);
        if (candidate == null) {
            update.setNull(room.owner);
        } else {
            update.set(room.owner, candidate);
        }
        return update
                .where(room.id.eq(roomId), room.owner.eq(expected))
                .execute();
    }
}
