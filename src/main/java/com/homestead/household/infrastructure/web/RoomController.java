package com.homestead.household.infrastructure.web;

import com.homestead.household.application.RoomService;
import com.homestead.household.domain.model.Room;
import com.homestead.household.infrastructure.web.dto.CreateRoomRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class RoomController {

    private final RoomService roomService;

    public RoomController(RoomService roomService) {
        this.roomService = roomService;
    }

    @PostMapping("/homes/{homeId}/rooms")
    public ResponseEntity<Room> createRoom(@PathVariable long homeId, @Valid @RequestBody CreateRoomRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(roomService.createRoom(homeId, request.name()));
    }

    @GetMapping("/homes/{homeId}/rooms")
    public ResponseEntity<List<Room>> getRoomsForHome(@PathVariable long homeId) {
        return ResponseEntity.ok(roomService.getRoomsForHome(homeId));
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<Room> getRoom(@PathVariable long roomId) {
        return ResponseEntity.ok(roomService.getRoom(roomId));
    }

    @DeleteMapping("/rooms/{roomId}")
    public ResponseEntity<Void> deleteRoom(@PathVariable long roomId) {
        roomService.deleteRoom(roomId);
        return ResponseEntity.noContent().build();
    }
}
