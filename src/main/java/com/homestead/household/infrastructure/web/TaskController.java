package com.homestead.household.infrastructure.web;

import com.homestead.household.application.TaskService;
import com.homestead.household.domain.model.Task;
import com.homestead.household.domain.model.TaskAssignment;
import com.homestead.household.infrastructure.web.dto.AssignTaskRequest;
import com.homestead.household.infrastructure.web.dto.CreateTaskRequest;
import com.homestead.household.infrastructure.web.dto.ReassignRoomRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping("/homes/{homeId}/tasks")
    public ResponseEntity<Task> createTask(@PathVariable long homeId, @Valid @RequestBody CreateTaskRequest request) {
        Task task = taskService.createTask(homeId, request.roomId(), request.name(),
                request.description(), request.scheduleType());
        return ResponseEntity.status(HttpStatus.CREATED).body(task);
    }

    @GetMapping("/homes/{homeId}/tasks")
    public ResponseEntity<List<Task>> getTasksForHome(@PathVariable long homeId) {
        return ResponseEntity.ok(taskService.getTasksForHome(homeId));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<Task> getTask(@PathVariable long taskId) {
        return ResponseEntity.ok(taskService.getTask(taskId));
    }

    @PutMapping("/tasks/{taskId}/room")
    public ResponseEntity<Task> reassignRoom(@PathVariable long taskId, @RequestBody ReassignRoomRequest request) {
        return ResponseEntity.ok(taskService.reassignRoom(taskId, request.roomId()));
    }

    @DeleteMapping("/tasks/{taskId}")
    public ResponseEntity<Void> deleteTask(@PathVariable long taskId) {
        taskService.deleteTask(taskId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/tasks/{taskId}/assignments")
    public ResponseEntity<TaskAssignment> assignUser(@PathVariable long taskId,
                                                     @Valid @RequestBody AssignTaskRequest request) {
        TaskAssignment assignment = taskService.assignUser(taskId, request.userId(), request.date());
        return ResponseEntity.status(HttpStatus.CREATED).body(assignment);
    }

    @GetMapping("/assignments/{assignmentId}")
    public ResponseEntity<TaskAssignment> getAssignment(@PathVariable long assignmentId) {
        return ResponseEntity.ok(taskService.getAssignment(assignmentId));
    }

    @GetMapping("/users/me/assignments")
    public ResponseEntity<List<TaskAssignment>> getMyAssignments(@RequestHeader(ApiHeaders.USER_ID) long userId) {
        return ResponseEntity.ok(taskService.getAssignmentsForUser(userId));
    }

    @GetMapping("/users/me/assignments/closest")
    public ResponseEntity<TaskAssignment> getMyClosestAssignment(@RequestHeader(ApiHeaders.USER_ID) long userId) {
        return taskService.getClosestAssignmentForUser(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/assignments/{assignmentId}/complete")
    public ResponseEntity<TaskAssignment> completeAssignment(@PathVariable long assignmentId) {
        return ResponseEntity.ok(taskService.completeAssignment(assignmentId));
    }

    @PostMapping("/assignments/{assignmentId}/uncomplete")
    public ResponseEntity<TaskAssignment> uncompleteAssignment(@PathVariable long assignmentId) {
        return ResponseEntity.ok(taskService.uncompleteAssignment(assignmentId));
    }

    @DeleteMapping("/assignments/{assignmentId}")
    public ResponseEntity<Void> deleteAssignment(@PathVariable long assignmentId) {
        taskService.deleteAssignment(assignmentId);
        return ResponseEntity.noContent().build();
    }
}
