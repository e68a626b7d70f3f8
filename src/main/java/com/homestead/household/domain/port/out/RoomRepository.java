package com.homestead.household.domain.port.out;

import com.homestead.household.domain.model.Room;
import java.util.List;
import java.util.Optional;

public interface RoomRepository {

    Room create(Room room);

    Optional<Room> findById(long id);

    List<Room> findByHomeId(long homeId);

    void delete(long id);
}
