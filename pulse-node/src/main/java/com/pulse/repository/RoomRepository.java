package com.pulse.repository;

import com.pulse.model.Room;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RoomRepository extends JpaRepository<Room, String>, RoomRepositoryCustom {
}
