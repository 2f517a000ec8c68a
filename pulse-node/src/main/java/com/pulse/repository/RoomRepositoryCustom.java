package com.pulse.repository;

/**
 * owner 컬럼에 대한 조건부 갱신. 모든 메서드는 실제로 갱신된 행 수를 반환한다.
 */
public interface RoomRepositoryCustom {

    String findOwnerById(String roomId);

    long claimOwner(String roomId, String candidate);

    long compareAndSetOwner(String roomId, String expected, String candidate);
}
