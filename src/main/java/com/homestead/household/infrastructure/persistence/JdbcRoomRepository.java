package com.homestead.household.infrastructure.persistence;

import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Room;
import com.homestead.household.domain.port.out.RoomRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcRoomRepository extends JdbcRepositorySupport implements RoomRepository {

    private static final RowMapper<Room> ROOM_MAPPER = (rs, rowNum) -> new Room(
            rs.getLong("id"),
            rs.getLong("home_id"),
            rs.getString("name"),
            instant(rs, "created_at")
    );

    public JdbcRoomRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate);
    }

    @Override
    public Room create(Room room) {
        return execute("creating room", () -> jdbcTemplate.queryForObject(
                "INSERT INTO rooms (home_id, name) VALUES (?, ?) RETURNING id, home_id, name, created_at",
                ROOM_MAPPER, room.homeId(), room.name()));
    }

    @Override
    public Optional<Room> findById(long id) {
        return execute("finding room " + id, () -> first(jdbcTemplate.query(
                "SELECT id, home_id, name, created_at FROM rooms WHERE id = ?", ROOM_MAPPER, id)));
    }

    @Override
    public List<Room> findByHomeId(long homeId) {
        return execute("finding rooms of home " + homeId, () -> jdbcTemplate.query(
                "SELECT id, home_id, name, created_at FROM rooms WHERE home_id = ? ORDER BY id", ROOM_MAPPER, homeId));
    }

    @Override
    public void delete(long id) {
        int deleted = execute("deleting room " + id, () -> jdbcTemplate.update("DELETE FROM rooms WHERE id = ?", id));
        if (deleted == 0) {
            throw new EntityNotFoundException("room", id);
        }
    }
}
