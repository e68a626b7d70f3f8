package com.homestead.household.application;

import com.fasterxml.jackson.core.type.TypeReference;
import com.homestead.household.domain.event.Action;
import com.homestead.household.domain.event.DomainEvent;
import com.homestead.household.domain.event.Module;
import com.homestead.household.domain.exception.EntityNotFoundException;
import com.homestead.household.domain.model.Task;
import com.homestead.household.domain.model.TaskAssignment;
import com.homestead.household.domain.port.out.TaskRepository;
import com.homestead.household.infrastructure.cache.CacheAsideTemplate;
import com.homestead.household.infrastructure.cache.CacheMutation;
import com.homestead.household.infrastructure.cache.key.CacheKey;
import com.homestead.household.infrastructure.cache.key.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class TaskService {

    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {};
    private static final TypeReference<List<TaskAssignment>> ASSIGNMENT_LIST = new TypeReference<>() {};

    private final TaskRepository taskRepository;
    private final CacheAsideTemplate cacheAside;

    public TaskService(TaskRepository taskRepository, CacheAsideTemplate cacheAside) {
        this.taskRepository = taskRepository;
        this.cacheAside = cacheAside;
    }

    public Task createTask(long homeId, Long roomId, String name, String description, String scheduleType) {
        Task task = cacheAside.execute(CacheMutation
                .writing(() -> taskRepository.create(new Task(null, homeId, roomId, name, description, scheduleType, null)))
                .invalidate(CacheKeys.tasksForHome(homeId))
                .publish(created -> DomainEvent.of(Module.TASK, Action.CREATED, created))
                .build());

        logger.info("Created task {} in home {}", task.id(), homeId);
        return task;
    }

    public Task getTask(long taskId) {
        return cacheAside.readThrough(CacheKeys.task(taskId), Task.class, () -> findTask(taskId));
    }

    public List<Task> getTasksForHome(long homeId) {
        return cacheAside.readThrough(CacheKeys.tasksForHome(homeId), TASK_LIST,
                () -> taskRepository.findByHomeId(homeId));
    }

    public Task reassignRoom(long taskId, Long roomId) {
        Task task = findTask(taskId);

        return cacheAside.execute(CacheMutation
                .writing(() -> taskRepository.reassignRoom(taskId, roomId))
                .invalidate(CacheKeys.task(taskId), CacheKeys.tasksForHome(task.homeId()))
                .publish(updated -> DomainEvent.of(Module.TASK, Action.UPDATED, updated))
                .repopulate(CacheKeys.task(taskId))
                .build());
    }

    /**
     * Deletes the task together with its assignments.
     * Assignees are read first because their cached assignment lists go stale with the task.
     */
    public void deleteTask(long taskId) {
        Task task = findTask(taskId);
        List<TaskAssignment> assignments = taskRepository.findAssignmentsByTaskId(taskId);

        List<CacheKey> keys = new ArrayList<>();
        keys.add(CacheKeys.task(taskId));
        keys.add(CacheKeys.tasksForHome(task.homeId()));
        for (TaskAssignment assignment : assignments) {
            keys.add(CacheKeys.assignment(assignment.id()));
            keys.addAll(userAssignmentKeys(assignment.userId()));
        }

        cacheAside.execute(CacheMutation
                .running(() -> taskRepository.delete(taskId))
                .invalidate(keys)
                .publish(ignored -> DomainEvent.deleted(Module.TASK, taskId))
                .build());

        logger.info("Deleted task {} with {} assignments", taskId, assignments.size());
    }

    public TaskAssignment assignUser(long taskId, long userId, LocalDate date) {
        Task task = findTask(taskId);

        List<CacheKey> keys = new ArrayList<>();
        keys.add(CacheKeys.task(taskId));
        keys.add(CacheKeys.tasksForHome(task.homeId()));
        keys.addAll(userAssignmentKeys(userId));

        return cacheAside.execute(CacheMutation
                .writing(() -> taskRepository.assignUser(taskId, userId, date))
                .invalidate(keys)
                .publish(assignment -> DomainEvent.of(Module.TASK, Action.ASSIGNED, assignment))
                .build());
    }

    public TaskAssignment getAssignment(long assignmentId) {
        return cacheAside.readThrough(CacheKeys.assignment(assignmentId), TaskAssignment.class,
                () -> findAssignment(assignmentId));
    }

    public List<TaskAssignment> getAssignmentsForUser(long userId) {
        return cacheAside.readThrough(CacheKeys.assignmentsForUser(userId), ASSIGNMENT_LIST,
                () -> taskRepository.findAssignmentsForUser(userId));
    }

    public Optional<TaskAssignment> getClosestAssignmentForUser(long userId) {
        return cacheAside.readThroughOptional(CacheKeys.closestAssignmentForUser(userId), TaskAssignment.class,
                () -> taskRepository.findClosestAssignmentForUser(userId));
    }

    public TaskAssignment completeAssignment(long assignmentId) {
        TaskAssignment assignment = findAssignment(assignmentId);

        return cacheAside.execute(CacheMutation
                .writing(() -> taskRepository.markCompleted(assignmentId))
                .invalidate(assignmentKeys(assignment))
                .publish(completed -> DomainEvent.of(Module.TASK, Action.COMPLETED, completed))
                .repopulate(CacheKeys.assignment(assignmentId))
                .build());
    }

    public TaskAssignment uncompleteAssignment(long assignmentId) {
        TaskAssignment assignment = findAssignment(assignmentId);

        return cacheAside.execute(CacheMutation
                .writing(() -> taskRepository.markUncompleted(assignmentId))
                .invalidate(assignmentKeys(assignment))
                .publish(reopened -> DomainEvent.of(Module.TASK, Action.UNCOMPLETED, reopened))
                .repopulate(CacheKeys.assignment(assignmentId))
                .build());
    }

    public void deleteAssignment(long assignmentId) {
        TaskAssignment assignment = findAssignment(assignmentId);

        cacheAside.execute(CacheMutation
                .running(() -> taskRepository.deleteAssignment(assignmentId))
                .invalidate(assignmentKeys(assignment))
                .publish(ignored -> DomainEvent.of(Module.TASK, Action.DELETED,
                        Map.of("assignment_id", assignmentId, "task_id", assignment.taskId())))
                .build());
    }

    private Task findTask(long taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new EntityNotFoundException("task", taskId));
    }

    private TaskAssignment findAssignment(long assignmentId) {
        return taskRepository.findAssignmentById(assignmentId)
                .orElseThrow(() -> new EntityNotFoundException("assignment", assignmentId));
    }

    private static List<CacheKey> assignmentKeys(TaskAssignment assignment) {
        List<CacheKey> keys = new ArrayList<>();
        keys.add(CacheKeys.assignment(assignment.id()));
        keys.addAll(userAssignmentKeys(assignment.userId()));
        return keys;
    }

    private static List<CacheKey> userAssignmentKeys(long userId) {
        return List.of(CacheKeys.assignmentsForUser(userId), CacheKeys.closestAssignmentForUser(userId));
    }
}
