package com.homestead.household.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Room;
import com.homestead.household.domain.model.Task;
import com.homestead.household.domain.port.out.RoomRepository;
import com.homestead.household.domain.port.out.TaskRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class RoomService {

    private static final TypeReference<List<Room>> ROOM_LIST = new TypeReference<>() {};

    private final RoomRepository roomRepository;
    private final TaskRepository taskRepository;
    private final CacheAsideTemplate cacheAside;

    public RoomService(RoomRepository roomRepository, TaskRepository taskRepository, CacheAsideTemplate cacheAside) {
        this.roomRepository = roomRepository;
        this.taskRepository = taskRepository;
        this.cacheAside = cacheAside;
    }

    public Room createRoom(long homeId, String name) {
        return cacheAside.execute(CacheMutation
                .writing(() -> roomRepository.create(new Room(null, homeId, name, null)))
                .invalidate(CacheKeys.roomsForHome(homeId))
                .publish(created -> DomainEvent.of(Module.ROOM, Action.CREATED, created))
                .build());
    }

    public Room getRoom(long roomId) {
        return cacheAside.readThrough(CacheKeys.room(roomId), Room.class, () -> findRoom(roomId));
    }

    public List<Room> getRoomsForHome(long homeId) {
        return cacheAside.readThrough(CacheKeys.roomsForHome(homeId), ROOM_LIST,
                () -> roomRepository.findByHomeId(homeId));
    }

    /**
     * Deletes the room. Tasks placed in it lose their room, so their cached copies go too.
     */
    public Room deleteRoom(long roomId) {
        Room room = findRoom(roomId);
        List<Task> tasks = taskRepository.findByRoomId(roomId);

        List<CacheKey> keys = new ArrayList<>();
        keys.add(CacheKeys.room(roomId));
        keys.add(CacheKeys.roomsForHome(room.homeId()));
        keys.add(CacheKeys.tasksForHome(room.homeId()));
        tasks.forEach(task -> keys.add(CacheKeys.task(task.id())));

        cacheAside.execute(CacheMutation
                .running(() -> roomRepository.delete(roomId))
                .invalidate(keys)
                .publish(ignored -> DomainEvent.of(Module.ROOM, Action.DELETED, room))
                .build());
        return room;
    }

    private Room findRoom(long roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new EntityNotFoundException("room", roomId));
    }
}
